package org.maplan.base.util.planning;

import java.util.List;

/**
 * Something that can check a sequential plan against a classical problem.
 *
 * Implementations must be safe to call from several threads at once.
 */
public interface PlanChecker
{
  /**
   * @return the name reported in results.
   */
  public String getName();

  /**
   * @return the features this checker understands.
   */
  public ProblemKind supportedKind();

  /**
   * @return whether this checker understands every feature of a problem.
   *
   * @param xiKind - the problem's kind.
   */
  public boolean supports(ProblemKind xiKind);

  /**
   * Check a plan.
   *
   * @param xiProblem - the problem.
   * @param xiPlan - the actions, in execution order.
   *
   * @return the verdict.  A plan that can't be executed or that misses the goal is INVALID; this never throws for
   *         such plans.
   */
  public ValidationResult validate(ClassicalProblem xiProblem, List<ClassicalActionInstance> xiPlan);
}
