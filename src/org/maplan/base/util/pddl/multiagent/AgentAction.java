package org.maplan.base.util.pddl.multiagent;

import java.util.List;

import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlParameterList;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;

import com.google.common.collect.ImmutableList;

/**
 * An action that an agent can perform.  Conditions and effects refer to the executing agent through the agent
 * variable, which is not one of the (ordinary) parameters.
 */
public final class AgentAction
{
  private final String                     mName;
  private final String                     mAgentVariable;
  private final PddlParameterList          mParameters;
  private final ImmutableList<PddlLiteral> mPrecondition;
  private final ImmutableList<PddlLiteral> mEffect;

  /**
   * Create an agent action.
   *
   * @param xiName - the action name.
   * @param xiAgentVariable - the variable standing for the executing agent, e.g. "?r".
   * @param xiParameters - the ordinary parameters.
   * @param xiPrecondition - the precondition literals.
   * @param xiEffect - the effect literals.
   */
  public AgentAction(String xiName,
                     String xiAgentVariable,
                     List<PddlTypedParameter> xiParameters,
                     List<PddlLiteral> xiPrecondition,
                     List<PddlLiteral> xiEffect)
  {
    mName = xiName;
    mAgentVariable = xiAgentVariable;
    mParameters = new PddlParameterList(xiParameters);
    mPrecondition = ImmutableList.copyOf(xiPrecondition);
    mEffect = ImmutableList.copyOf(xiEffect);
  }

  public String getName()
  {
    return mName;
  }

  public String getAgentVariable()
  {
    return mAgentVariable;
  }

  public PddlParameterList getParameters()
  {
    return mParameters;
  }

  public List<PddlLiteral> getPrecondition()
  {
    return mPrecondition;
  }

  public List<PddlLiteral> getEffect()
  {
    return mEffect;
  }
}
