package org.maplan.base.util.planning.plan;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A totally ordered plan.
 */
public final class SequentialPlan extends Plan
{
  private final ImmutableList<ActionOccurrence> mActions;

  public SequentialPlan(List<ActionOccurrence> xiActions)
  {
    mActions = ImmutableList.copyOf(xiActions);
  }

  @Override
  public PlanKind getKind()
  {
    return PlanKind.SEQUENTIAL_PLAN;
  }

  @Override
  public List<ActionOccurrence> getActions()
  {
    return mActions;
  }

  @Override
  public String toString()
  {
    return mActions.toString();
  }
}
