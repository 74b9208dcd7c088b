package org.maplan.base.util.planning;

import java.util.Set;

import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.TypeHierarchy;

/**
 * A classical planning problem, addressable by action and object name.
 */
public final class ClassicalProblem
{
  private final PlanningTask mTask;
  private final ProblemKind  mKind;

  public ClassicalProblem(PlanningTask xiTask)
  {
    mTask = xiTask;
    mKind = ProblemKind.of(xiTask);
  }

  public String getName()
  {
    return mTask.getProblem().getName();
  }

  public PlanningTask getTask()
  {
    return mTask;
  }

  public ProblemKind getKind()
  {
    return mKind;
  }

  public TypeHierarchy getTypes()
  {
    return mTask.getDomain().getTypes();
  }

  /**
   * @return the named action, or null if there isn't one.
   *
   * @param xiName - the action name.
   */
  public PddlAction getAction(String xiName)
  {
    return mTask.getDomain().getAction(xiName);
  }

  /**
   * @return the declared type of an object or constant, or null if there's no such object.
   *
   * @param xiName - the object name.
   */
  public String getObjectType(String xiName)
  {
    return mTask.getTypeOfObject(xiName);
  }

  public Set<String> getObjects()
  {
    return mTask.getObjects();
  }
}
