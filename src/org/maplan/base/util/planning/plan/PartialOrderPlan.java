package org.maplan.base.util.planning.plan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * A plan whose actions are only partially ordered.  Nodes are identified by their position in {@link #getActions()}.
 *
 * The ordering is always acyclic, so the plan has at least one linearization.
 */
public final class PartialOrderPlan extends Plan
{
  private final ImmutableList<ActionOccurrence>       mActions;
  private final ImmutableSetMultimap<Integer, Integer> mSuccessors;

  /**
   * Create a plan.
   *
   * @param xiActions - the action occurrences.
   * @param xiSuccessors - for each node, the nodes that must come after it.
   *
   * @throws IllegalArgumentException if the ordering refers to a node that doesn't exist or contains a cycle.
   */
  public PartialOrderPlan(List<ActionOccurrence> xiActions, SetMultimap<Integer, Integer> xiSuccessors)
  {
    mActions = ImmutableList.copyOf(xiActions);
    mSuccessors = ImmutableSetMultimap.copyOf(xiSuccessors);

    for (Integer lNode : Iterables.concat(mSuccessors.keySet(), mSuccessors.values()))
    {
      Preconditions.checkArgument((lNode >= 0) && (lNode < mActions.size()), "No such node: %s", lNode);
    }
    Preconditions.checkArgument(isAcyclic(), "Ordering constraints contain a cycle: %s", mSuccessors);
  }

  private boolean isAcyclic()
  {
    int[] lInDegree = inDegrees();
    List<Integer> lReady = new ArrayList<>();
    for (int lii = 0; lii < lInDegree.length; lii++)
    {
      if (lInDegree[lii] == 0)
      {
        lReady.add(lii);
      }
    }

    int lVisited = 0;
    while (!lReady.isEmpty())
    {
      int lNode = lReady.remove(lReady.size() - 1);
      lVisited++;
      for (int lSuccessor : mSuccessors.get(lNode))
      {
        if (--lInDegree[lSuccessor] == 0)
        {
          lReady.add(lSuccessor);
        }
      }
    }
    return lVisited == mActions.size();
  }

  /**
   * @return the number of predecessors of each node.
   */
  int[] inDegrees()
  {
    int[] lInDegree = new int[mActions.size()];
    for (Integer lSuccessor : mSuccessors.values())
    {
      lInDegree[lSuccessor]++;
    }
    return lInDegree;
  }

  @Override
  public PlanKind getKind()
  {
    return PlanKind.PARTIAL_ORDER_PLAN;
  }

  @Override
  public List<ActionOccurrence> getActions()
  {
    return mActions;
  }

  /**
   * @return the nodes that must come after the specified node.
   *
   * @param xiNode - the node.
   */
  public Set<Integer> getSuccessors(int xiNode)
  {
    return mSuccessors.get(xiNode);
  }

  /**
   * @return every order in which the nodes can be executed, generated lazily.
   */
  public Iterable<List<Integer>> linearizations()
  {
    return new Iterable<List<Integer>>()
    {
      @Override
      public Iterator<List<Integer>> iterator()
      {
        return new LinearizationIterator(PartialOrderPlan.this);
      }
    };
  }

  /**
   * @return every sequential plan consistent with this plan, generated lazily.
   */
  public Iterable<SequentialPlan> allSequentialPlans()
  {
    return Iterables.transform(linearizations(), new Function<List<Integer>, SequentialPlan>()
    {
      @Override
      public SequentialPlan apply(List<Integer> xiOrder)
      {
        List<ActionOccurrence> lActions = new ArrayList<>(xiOrder.size());
        for (int lNode : xiOrder)
        {
          lActions.add(mActions.get(lNode));
        }
        return new SequentialPlan(lActions);
      }
    });
  }

  @Override
  public String toString()
  {
    return mActions + " ordered by " + mSuccessors;
  }

  /**
   * Accumulates the nodes and orderings of a partial-order plan.
   */
  public static final class Builder
  {
    private final List<ActionOccurrence>      mActions    = new ArrayList<>();
    private final SetMultimap<Integer, Integer> mSuccessors = LinkedHashMultimap.create();

    /**
     * Add a node.
     *
     * @param xiAction - the action occurrence.
     *
     * @return the node's identifier.
     */
    public int addAction(ActionOccurrence xiAction)
    {
      mActions.add(xiAction);
      return mActions.size() - 1;
    }

    /**
     * Require one node to come before another.
     *
     * @param xiBefore - the earlier node.
     * @param xiAfter - the later node.
     */
    public Builder addOrdering(int xiBefore, int xiAfter)
    {
      mSuccessors.put(xiBefore, xiAfter);
      return this;
    }

    /**
     * @return the plan.
     *
     * @throws IllegalArgumentException if the orderings contain a cycle.
     */
    public PartialOrderPlan build()
    {
      return new PartialOrderPlan(mActions, mSuccessors);
    }
  }
}
