package org.maplan.base.util.pddl.multiagent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;

/**
 * An agent of a multi-agent problem: a typed object with its own private predicates and actions.
 */
public final class Agent
{
  private final String                       mName;
  private final String                       mType;
  private final List<PddlPredicateSignature> mPrivatePredicates = new ArrayList<>();
  private final List<AgentAction>            mActions           = new ArrayList<>();

  public Agent(String xiName, String xiType)
  {
    mName = xiName;
    mType = xiType;
  }

  public String getName()
  {
    return mName;
  }

  public String getType()
  {
    return mType;
  }

  public Agent addPrivatePredicate(PddlPredicateSignature xiPredicate)
  {
    mPrivatePredicates.add(xiPredicate);
    return this;
  }

  public Agent addAction(AgentAction xiAction)
  {
    mActions.add(xiAction);
    return this;
  }

  public List<PddlPredicateSignature> getPrivatePredicates()
  {
    return Collections.unmodifiableList(mPrivatePredicates);
  }

  public List<AgentAction> getActions()
  {
    return Collections.unmodifiableList(mActions);
  }
}
