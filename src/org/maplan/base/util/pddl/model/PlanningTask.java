package org.maplan.base.util.pddl.model;

import java.util.LinkedHashSet;
import java.util.Map.Entry;
import java.util.Set;

/**
 * A domain together with one of its problems.  Answers the queries that need both halves: object types, objects of a
 * type (including descendant types) and the set of agents.
 */
public final class PlanningTask
{
  private final DomainModel  mDomain;
  private final ProblemModel mProblem;

  public PlanningTask(DomainModel xiDomain, ProblemModel xiProblem)
  {
    mDomain = xiDomain;
    mProblem = xiProblem;
  }

  public DomainModel getDomain()
  {
    return mDomain;
  }

  public ProblemModel getProblem()
  {
    return mProblem;
  }

  /**
   * @return the problem objects, each once, in declaration order.
   */
  public Set<String> getObjects()
  {
    return new LinkedHashSet<>(mProblem.getObjects().values());
  }

  /**
   * @return the declared type of an object or constant, or null if it is neither.  Problem objects are searched
   *         before domain constants.
   *
   * @param xiObject - the object name.
   */
  public String getTypeOfObject(String xiObject)
  {
    for (Entry<String, String> lEntry : mProblem.getObjects().entries())
    {
      if (lEntry.getValue().equals(xiObject))
      {
        return lEntry.getKey();
      }
    }
    for (Entry<String, String> lEntry : mDomain.getConstants().entries())
    {
      if (lEntry.getValue().equals(xiObject))
      {
        return lEntry.getKey();
      }
    }
    return null;
  }

  /**
   * @return every object and constant whose type is the specified type or transitively descends from it.
   *
   * @param xiType - the type.
   */
  public Set<String> getObjectsOfType(String xiType)
  {
    Set<String> lSelected = new LinkedHashSet<>();
    for (String lType : mDomain.getTypes().getDescendants(xiType))
    {
      lSelected.addAll(mProblem.getObjects().get(lType));
      lSelected.addAll(mDomain.getConstants().get(lType));
    }
    return lSelected;
  }

  /**
   * @return the objects that can act as agents, i.e. the objects of every agent-parameter type.
   */
  public Set<String> getAgents()
  {
    Set<String> lAgents = new LinkedHashSet<>();
    for (String lAgentType : mDomain.getAgentTypes())
    {
      lAgents.addAll(getObjectsOfType(lAgentType));
    }
    return lAgents;
  }
}
