package org.maplan.base.util.pddl.multiagent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * In-memory description of a multi-agent planning problem.  Written out as unfactored MA-PDDL on request.
 *
 * Agents are objects in their own right and are declared as such when the problem is written, so they must not also
 * be added with {@link #addObject(String, String)}.
 */
public class MultiAgentProblem implements MultiAgentPddlSource
{
  private final String                       mName;
  private final String                       mDomainName;
  private final Set<String>                  mRequirements  = new LinkedHashSet<>();
  private final TypeHierarchy.Builder        mTypes         = new TypeHierarchy.Builder();
  private final List<PddlPredicateSignature> mPredicates    = new ArrayList<>();
  private final List<PddlFunctionSignature>  mFunctions     = new ArrayList<>();
  private final List<Agent>                  mAgents        = new ArrayList<>();
  private final SetMultimap<String, String>  mObjects       = LinkedHashMultimap.create();
  private final List<PddlAtom>               mInit          = new ArrayList<>();
  private final List<PddlGroundFunctionValue> mInitFunctions = new ArrayList<>();
  private final List<PddlLiteral>            mGoal          = new ArrayList<>();
  private boolean                            mMetric;

  /**
   * Create an empty problem.
   *
   * @param xiName - the problem name.
   * @param xiDomainName - the domain name.
   */
  public MultiAgentProblem(String xiName, String xiDomainName)
  {
    mName = xiName;
    mDomainName = xiDomainName;
    mRequirements.add("typing");
  }

  @Override
  public String getName()
  {
    return mName;
  }

  public String getDomainName()
  {
    return mDomainName;
  }

  public MultiAgentProblem addRequirement(String xiRequirement)
  {
    mRequirements.add(xiRequirement);
    return this;
  }

  /**
   * Declare a type.
   *
   * @param xiType - the new type.
   * @param xiSupertype - its parent, or null for a type directly under the root.
   */
  public MultiAgentProblem addType(String xiType, String xiSupertype)
  {
    if (xiSupertype == null)
    {
      mTypes.declareTopLevel(xiType);
    }
    else
    {
      mTypes.declare(xiType, xiSupertype);
    }
    return this;
  }

  public MultiAgentProblem addPredicate(PddlPredicateSignature xiPredicate)
  {
    mPredicates.add(xiPredicate);
    return this;
  }

  public MultiAgentProblem addFunction(PddlFunctionSignature xiFunction)
  {
    mFunctions.add(xiFunction);
    return this;
  }

  public MultiAgentProblem addAgent(Agent xiAgent)
  {
    mAgents.add(xiAgent);
    return this;
  }

  public MultiAgentProblem addObject(String xiName, String xiType)
  {
    mObjects.put(xiType, xiName);
    return this;
  }

  public MultiAgentProblem addInit(PddlAtom xiFact)
  {
    mInit.add(xiFact);
    return this;
  }

  public MultiAgentProblem addInit(PddlGroundFunctionValue xiValue)
  {
    mInitFunctions.add(xiValue);
    return this;
  }

  public MultiAgentProblem addGoal(PddlLiteral xiGoal)
  {
    mGoal.add(xiGoal);
    return this;
  }

  /**
   * Ask for total-cost minimisation.
   */
  public MultiAgentProblem setMetric()
  {
    mMetric = true;
    return this;
  }

  public Set<String> getRequirements()
  {
    return Collections.unmodifiableSet(mRequirements);
  }

  public TypeHierarchy getTypes()
  {
    return mTypes.build();
  }

  public List<PddlPredicateSignature> getPredicates()
  {
    return Collections.unmodifiableList(mPredicates);
  }

  public List<PddlFunctionSignature> getFunctions()
  {
    return Collections.unmodifiableList(mFunctions);
  }

  public List<Agent> getAgents()
  {
    return Collections.unmodifiableList(mAgents);
  }

  public SetMultimap<String, String> getObjects()
  {
    return mObjects;
  }

  public List<PddlAtom> getInit()
  {
    return Collections.unmodifiableList(mInit);
  }

  public List<PddlGroundFunctionValue> getInitFunctions()
  {
    return Collections.unmodifiableList(mInitFunctions);
  }

  public List<PddlLiteral> getGoal()
  {
    return Collections.unmodifiableList(mGoal);
  }

  public boolean hasMetric()
  {
    return mMetric;
  }

  @Override
  public String writeDomain()
  {
    return new MultiAgentPddlWriter().writeDomain(this);
  }

  @Override
  public String writeProblem()
  {
    return new MultiAgentPddlWriter().writeProblem(this);
  }
}
