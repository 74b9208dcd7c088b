package org.maplan.base.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.Level;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.maplan.base.util.planning.ClassicalActionInstance;
import org.maplan.base.util.planning.ClassicalProblem;
import org.maplan.base.util.planning.SequentialPlanValidator;
import org.maplan.base.util.planning.ValidationResult;
import org.maplan.base.util.planning.plan.ActionOccurrence;
import org.maplan.base.util.planning.plan.PartialOrderPlan;
import org.maplan.base.util.planning.plan.SequentialPlan;
import org.maplan.base.validator.LinearizationPolicy;
import org.maplan.base.validator.LinearizationSearch;
import org.maplan.base.validator.PlanRemapper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class LinearizationTests extends Assert
{
  private static final ActionOccurrence R1_MOVE = new ActionOccurrence("move", "r1", "l1", "l3");
  private static final ActionOccurrence R2_MOVE = new ActionOccurrence("move", "r2", "l2", "l1");

  private ClassicalProblem mProblem;
  private PlanRemapper     mRemapper;

  @Before
  public void setUp() throws Exception
  {
    mProblem = RobotProblems.classical(RobotProblems.twoRobots());
    mRemapper = new PlanRemapper(mProblem);
  }

  private static PartialOrderPlan unordered(int xiSize)
  {
    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    for (int lii = 0; lii < xiSize; lii++)
    {
      lBuilder.addAction(new ActionOccurrence("noop", "a" + lii));
    }
    return lBuilder.build();
  }

  private ValidationResult search(LinearizationPolicy xiPolicy,
                                  int xiMax,
                                  int xiThreads,
                                  ActionOccurrence... xiNodes) throws Exception
  {
    List<ClassicalActionInstance> lNodes = mRemapper.remap(Arrays.asList(xiNodes));
    LinearizationSearch lSearch = new LinearizationSearch(new SequentialPlanValidator(),
                                                          mProblem,
                                                          xiPolicy,
                                                          xiMax,
                                                          xiThreads,
                                                          "test");
    return lSearch.search(lNodes, unordered(xiNodes.length).linearizations());
  }

  @Test
  public void testUnorderedPair()
  {
    List<List<Integer>> lOrders = Lists.newArrayList(unordered(2).linearizations());
    assertEquals(Arrays.asList(Arrays.asList(0, 1), Arrays.asList(1, 0)), lOrders);
  }

  @Test
  public void testPartialOrdering()
  {
    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    int lFirst = lBuilder.addAction(new ActionOccurrence("a", "x"));
    lBuilder.addAction(new ActionOccurrence("b", "x"));
    int lThird = lBuilder.addAction(new ActionOccurrence("c", "x"));
    lBuilder.addOrdering(lFirst, lThird);

    List<List<Integer>> lOrders = Lists.newArrayList(lBuilder.build().linearizations());
    assertEquals(Arrays.asList(Arrays.asList(0, 1, 2), Arrays.asList(0, 2, 1), Arrays.asList(1, 0, 2)), lOrders);
  }

  @Test
  public void testChain()
  {
    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    lBuilder.addAction(new ActionOccurrence("a", "x"));
    lBuilder.addAction(new ActionOccurrence("b", "x"));
    lBuilder.addAction(new ActionOccurrence("c", "x"));
    lBuilder.addOrdering(2, 1).addOrdering(1, 0);

    List<List<Integer>> lOrders = Lists.newArrayList(lBuilder.build().linearizations());
    assertEquals(1, lOrders.size());
    assertEquals(Arrays.asList(2, 1, 0), lOrders.get(0));
  }

  @Test
  public void testEmptyPlan()
  {
    List<List<Integer>> lOrders = Lists.newArrayList(unordered(0).linearizations());
    assertEquals(1, lOrders.size());
    assertTrue(lOrders.get(0).isEmpty());
  }

  @Test
  public void testAllSequentialPlans()
  {
    List<SequentialPlan> lPlans = Lists.newArrayList(unordered(3).allSequentialPlans());
    assertEquals(6, lPlans.size());
    assertEquals(ImmutableList.of(new ActionOccurrence("noop", "a0"),
                                  new ActionOccurrence("noop", "a1"),
                                  new ActionOccurrence("noop", "a2")),
                 lPlans.get(0).getActions());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCycleRejected()
  {
    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    lBuilder.addAction(new ActionOccurrence("a", "x"));
    lBuilder.addAction(new ActionOccurrence("b", "x"));
    lBuilder.addOrdering(0, 1).addOrdering(1, 0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownNodeRejected()
  {
    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    lBuilder.addAction(new ActionOccurrence("a", "x"));
    lBuilder.addOrdering(0, 3).build();
  }

  @Test
  public void testAnyFindsLaterOrder() throws Exception
  {
    // r2 can only move once r1 has freed l1, so [r2, r1] fails and [r1, r2] succeeds.
    ValidationResult lResult = search(LinearizationPolicy.ANY, -1, 1, R2_MOVE, R1_MOVE);
    assertEquals(ValidationResult.Status.VALID, lResult.getStatus());
    assertEquals(2, lResult.getLinearizationsChecked());
    assertEquals("test", lResult.getEngineName());
  }

  @Test
  public void testAnyStopsAtFirstValidOrder() throws Exception
  {
    ValidationResult lResult = search(LinearizationPolicy.ANY, -1, 1, R1_MOVE, R2_MOVE);
    assertTrue(lResult.isValid());
    assertEquals(1, lResult.getLinearizationsChecked());
  }

  @Test
  public void testAnyWithNoValidOrder() throws Exception
  {
    ValidationResult lResult = search(LinearizationPolicy.ANY, -1, 1, R1_MOVE, R1_MOVE);
    assertFalse(lResult.isValid());
    assertEquals(2, lResult.getLinearizationsChecked());
    assertEquals("None of the 2 linearizations is a valid plan", lResult.getLogMessages().get(0).getMessage());
  }

  @Test
  public void testAllStopsAtFirstInvalidOrder() throws Exception
  {
    ValidationResult lResult = search(LinearizationPolicy.ALL, -1, 1, R1_MOVE, R2_MOVE);
    assertFalse(lResult.isValid());
    assertEquals(2, lResult.getLinearizationsChecked());
  }

  @Test
  public void testAllWithOnlyValidOrders() throws Exception
  {
    ValidationResult lResult = search(LinearizationPolicy.ALL, -1, 1, R1_MOVE);
    assertFalse("r2 never moves, so the goal isn't reached", lResult.isValid());

    PartialOrderPlan.Builder lBuilder = new PartialOrderPlan.Builder();
    int lFirst = lBuilder.addAction(R1_MOVE);
    int lSecond = lBuilder.addAction(R2_MOVE);
    lBuilder.addOrdering(lFirst, lSecond);

    LinearizationSearch lSearch = new LinearizationSearch(new SequentialPlanValidator(),
                                                          mProblem,
                                                          LinearizationPolicy.ALL,
                                                          -1,
                                                          1,
                                                          "test");
    PartialOrderPlan lPlan = lBuilder.build();
    lResult = lSearch.search(mRemapper.remap(lPlan.getActions()), lPlan.linearizations());
    assertTrue(lResult.isValid());
    assertEquals("All 1 linearizations are valid plans", lResult.getLogMessages().get(0).getMessage());
  }

  @Test
  public void testLimitWithoutVerdict() throws Exception
  {
    ValidationResult lResult = search(LinearizationPolicy.ANY, 1, 1, R2_MOVE, R1_MOVE);
    assertFalse(lResult.isValid());
    assertEquals(1, lResult.getLinearizationsChecked());
    assertEquals(Level.WARN, lResult.getLogMessages().get(0).getLevel());
  }

  @Test
  public void testParallelSearch() throws Exception
  {
    assertTrue(search(LinearizationPolicy.ANY, -1, 4, R2_MOVE, R1_MOVE).isValid());
    assertTrue(search(LinearizationPolicy.ANY, -1, 2, R1_MOVE, R2_MOVE).isValid());

    ValidationResult lResult = search(LinearizationPolicy.ANY, -1, 2, R1_MOVE, R1_MOVE);
    assertFalse(lResult.isValid());
    assertEquals(2, lResult.getLinearizationsChecked());

    lResult = search(LinearizationPolicy.ANY, 1, 2, R2_MOVE, R1_MOVE);
    assertFalse(lResult.isValid());
    assertEquals(Level.WARN, lResult.getLogMessages().get(0).getLevel());
  }

  @Test
  public void testParallelMatchesInline() throws Exception
  {
    List<ValidationResult.Status> lInline = new ArrayList<>();
    List<ValidationResult.Status> lParallel = new ArrayList<>();
    for (LinearizationPolicy lPolicy : LinearizationPolicy.values())
    {
      lInline.add(search(lPolicy, -1, 1, R2_MOVE, R1_MOVE).getStatus());
      lParallel.add(search(lPolicy, -1, 3, R2_MOVE, R1_MOVE).getStatus());
    }
    assertEquals(lInline, lParallel);
  }
}
