package org.maplan.base.util.planning.plan;

import java.util.List;

/**
 * A multi-agent plan.
 */
public abstract class Plan
{
  /**
   * The kinds of plan.
   */
  public static enum PlanKind
  {
    SEQUENTIAL_PLAN,
    PARTIAL_ORDER_PLAN;
  }

  public abstract PlanKind getKind();

  /**
   * @return every action occurrence in the plan.  For a sequential plan this is the execution order.
   */
  public abstract List<ActionOccurrence> getActions();
}
