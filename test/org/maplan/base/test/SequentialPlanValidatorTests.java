package org.maplan.base.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.util.planning.ClassicalActionInstance;
import org.maplan.base.util.planning.ClassicalPddlReader;
import org.maplan.base.util.planning.ClassicalProblem;
import org.maplan.base.util.planning.ProblemKind;
import org.maplan.base.util.planning.ProblemKind.Feature;
import org.maplan.base.util.planning.SequentialPlanValidator;
import org.maplan.base.util.planning.ValidationResult;

public class SequentialPlanValidatorTests extends Assert
{
  private final SequentialPlanValidator mValidator = new SequentialPlanValidator();

  private static ClassicalProblem switches() throws Exception
  {
    return new ClassicalPddlReader(true).read(PddlTestRepository.getDomain("switches"),
                                              PddlTestRepository.getProblem("switches"));
  }

  private static List<ClassicalActionInstance> plan(ClassicalProblem xiProblem, String... xiSteps)
  {
    List<ClassicalActionInstance> lPlan = new ArrayList<>();
    for (String lStep : xiSteps)
    {
      String[] lParts = lStep.split(" ");
      lPlan.add(new ClassicalActionInstance(xiProblem.getAction(lParts[0]),
                                            Arrays.asList(lParts).subList(1, lParts.length)));
    }
    return lPlan;
  }

  @Test
  public void testValidPlan() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem, plan(lProblem, "turn-on s1", "turn-on master"));
    assertEquals(ValidationResult.Status.VALID, lResult.getStatus());
    assertEquals(SequentialPlanValidator.NAME, lResult.getEngineName());
  }

  @Test
  public void testGoalNotReached() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem, plan(lProblem, "turn-on s1"));
    assertEquals(ValidationResult.Status.INVALID, lResult.getStatus());
    assertTrue(lResult.getLogMessages().get(0).getMessage().contains("(on master)"));
  }

  @Test
  public void testNegativeGoal() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem,
                                                   plan(lProblem, "turn-on s1", "turn-on master", "turn-on s2"));
    assertFalse(lResult.isValid());
  }

  @Test
  public void testPreconditionFails() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem, plan(lProblem, "turn-on s1", "turn-on s1"));
    assertFalse(lResult.isValid());
    assertTrue(lResult.getLogMessages().get(0).getMessage().startsWith("Step 2"));
  }

  @Test
  public void testDeleteThenAdd() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem,
                                                   plan(lProblem,
                                                        "turn-on s1",
                                                        "turn-off s1",
                                                        "turn-on s1",
                                                        "turn-on master"));
    assertTrue(lResult.isValid());
  }

  @Test
  public void testUnknownObject() throws Exception
  {
    ClassicalProblem lProblem = switches();
    ValidationResult lResult = mValidator.validate(lProblem, plan(lProblem, "turn-on s9"));
    assertFalse(lResult.isValid());
    assertTrue(lResult.getLogMessages().get(0).getMessage().contains("unknown object s9"));
  }

  @Test
  public void testProblemKind() throws Exception
  {
    ProblemKind lKind = switches().getKind();
    assertEquals(EnumSet.of(Feature.TYPING, Feature.NEGATIVE_CONDITIONS, Feature.ACTION_COSTS), lKind.getFeatures());
    assertTrue(mValidator.supports(lKind));
    assertFalse(lKind.isSubsetOf(new ProblemKind(EnumSet.of(Feature.TYPING))));
    assertEquals(EnumSet.of(Feature.NEGATIVE_CONDITIONS, Feature.ACTION_COSTS),
                 lKind.missingFrom(new ProblemKind(EnumSet.of(Feature.TYPING))));
  }

  @Test
  public void testEqualityAndTypes() throws Exception
  {
    ClassicalProblem lProblem = new ClassicalPddlReader(false).read(
        "(define (domain d) (:types place truck - object)\n" +
        " (:predicates (at ?t - truck ?p - place))\n" +
        " (:action drive :parameters (?t - truck ?a ?b - place)\n" +
        "  :precondition (and (at ?t ?a) (not (= ?a ?b)))\n" +
        "  :effect (and (not (at ?t ?a)) (at ?t ?b))))",
        "(define (problem p) (:domain d) (:objects t - truck x y - place) (:init (at t x)) (:goal (at t y)))");

    assertTrue(lProblem.getKind().has(Feature.EQUALITIES));
    assertTrue(mValidator.validate(lProblem, plan(lProblem, "drive t x y")).isValid());
    assertFalse(mValidator.validate(lProblem, plan(lProblem, "drive t x x")).isValid());

    ValidationResult lResult = mValidator.validate(lProblem, plan(lProblem, "drive x t y"));
    assertFalse(lResult.isValid());
    assertTrue(lResult.getLogMessages().get(0).getMessage().contains("can't be bound"));
  }
}
