package org.maplan.base.util.planning.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.UnmodifiableIterator;

/**
 * Lazily enumerates the topological orders of a partial-order plan by backtracking.  Each call to {@link #next()}
 * does only the work needed to find one more order, so a caller that stops early never pays for the rest.
 *
 * Orders are produced in lexicographic order of node identifiers.  A plan with no actions has exactly one (empty)
 * linearization.
 */
public final class LinearizationIterator extends UnmodifiableIterator<List<Integer>>
{
  /**
   * One level of the search: the nodes that could be placed at this position and which of them is placed now.
   */
  private static final class Frame
  {
    final List<Integer> mCandidates;
    int                 mNext    = 0;
    int                 mCurrent = -1;

    Frame(List<Integer> xiCandidates)
    {
      mCandidates = xiCandidates;
    }
  }

  private final PartialOrderPlan mPlan;
  private final int              mSize;
  private final int[]            mInDegree;
  private final boolean[]        mPlaced;
  private final List<Integer>    mOrder = new ArrayList<>();
  private final Deque<Frame>     mStack = new ArrayDeque<>();

  private List<Integer> mPending;
  private boolean       mExhausted;

  public LinearizationIterator(PartialOrderPlan xiPlan)
  {
    mPlan = xiPlan;
    mSize = xiPlan.getActions().size();
    mInDegree = xiPlan.inDegrees();
    mPlaced = new boolean[mSize];

    if (mSize == 0)
    {
      mPending = ImmutableList.of();
    }
    else
    {
      mStack.push(new Frame(available()));
    }
  }

  @Override
  public boolean hasNext()
  {
    if ((mPending == null) && !mExhausted)
    {
      mPending = advance();
      mExhausted = (mPending == null);
    }
    return mPending != null;
  }

  @Override
  public List<Integer> next()
  {
    if (!hasNext())
    {
      throw new NoSuchElementException();
    }
    List<Integer> lResult = mPending;
    mPending = null;
    if (mSize == 0)
    {
      mExhausted = true;
    }
    return lResult;
  }

  /**
   * @return the next complete order, or null if there are no more.
   */
  private List<Integer> advance()
  {
    while (!mStack.isEmpty())
    {
      Frame lFrame = mStack.peek();
      if (lFrame.mCurrent != -1)
      {
        unplace(lFrame.mCurrent);
        lFrame.mCurrent = -1;
      }

      if (lFrame.mNext >= lFrame.mCandidates.size())
      {
        mStack.pop();
        continue;
      }

      int lNode = lFrame.mCandidates.get(lFrame.mNext++);
      lFrame.mCurrent = lNode;
      place(lNode);

      if (mOrder.size() == mSize)
      {
        return ImmutableList.copyOf(mOrder);
      }
      mStack.push(new Frame(available()));
    }
    return null;
  }

  private List<Integer> available()
  {
    List<Integer> lAvailable = new ArrayList<>();
    for (int lii = 0; lii < mSize; lii++)
    {
      if (!mPlaced[lii] && (mInDegree[lii] == 0))
      {
        lAvailable.add(lii);
      }
    }
    return lAvailable;
  }

  private void place(int xiNode)
  {
    mPlaced[xiNode] = true;
    mOrder.add(xiNode);
    for (int lSuccessor : mPlan.getSuccessors(xiNode))
    {
      mInDegree[lSuccessor]--;
    }
  }

  private void unplace(int xiNode)
  {
    mPlaced[xiNode] = false;
    mOrder.remove(mOrder.size() - 1);
    for (int lSuccessor : mPlan.getSuccessors(xiNode))
    {
      mInDegree[lSuccessor]++;
    }
  }
}
