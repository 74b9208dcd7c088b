package org.maplan.base.test;

import java.util.HashSet;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.util.pddl.factory.DomainParser;
import org.maplan.base.util.pddl.factory.PddlDialect;
import org.maplan.base.util.pddl.factory.ProblemParser;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;
import org.maplan.base.util.pddl.writer.ClassicalPddlWriter;

import com.google.common.collect.ImmutableSet;

public class ClassicalPddlWriterTests extends Assert
{
  private final ClassicalPddlWriter mWriter = new ClassicalPddlWriter();

  private static PlanningTask parse(PddlDialect xiDialect, String xiDomain, String xiProblem) throws Exception
  {
    DomainModel lDomain = new DomainParser(xiDialect).parse(xiDomain);
    ProblemModel lProblem = new ProblemParser(false).parse(xiProblem, lDomain);
    return new PlanningTask(lDomain, lProblem);
  }

  private PlanningTask reparse(PlanningTask xiTask) throws Exception
  {
    return parse(PddlDialect.CLASSICAL, mWriter.writeDomain(xiTask.getDomain()), mWriter.writeProblem(xiTask));
  }

  @Test
  public void testRoundTrip() throws Exception
  {
    PlanningTask lOriginal = parse(PddlDialect.MULTI_AGENT,
                                   PddlTestRepository.getDomain("robots"),
                                   PddlTestRepository.getProblem("robots"));
    PlanningTask lClassical = reparse(lOriginal);

    DomainModel lBefore = lOriginal.getDomain();
    DomainModel lAfter = lClassical.getDomain();
    assertEquals(lBefore.getName(), lAfter.getName());
    assertEquals(ImmutableSet.of("typing"), lAfter.getRequirements());
    assertEquals(lBefore.getTypes(), lAfter.getTypes());
    assertEquals(lBefore.getPredicates(), lAfter.getPredicates());
    assertEquals(lBefore.getActions(), lAfter.getActions());
    assertEquals("?r1 - robot", lAfter.getAction("move_r1").getParameters().get(0).toString());
    assertNull(lAfter.getAction("move_r1").getAgentType());

    ProblemModel lProblemBefore = lOriginal.getProblem();
    ProblemModel lProblemAfter = lClassical.getProblem();
    assertEquals(lProblemBefore.getObjects(), lProblemAfter.getObjects());
    assertEquals(new HashSet<>(lProblemBefore.getInit()), new HashSet<>(lProblemAfter.getInit()));
    assertEquals(new HashSet<>(lProblemBefore.getGoal()), new HashSet<>(lProblemAfter.getGoal()));
  }

  @Test
  public void testMultiAgentRequirementsAreDropped() throws Exception
  {
    PlanningTask lTask = parse(PddlDialect.MULTI_AGENT,
                               PddlTestRepository.getDomain("robots"),
                               PddlTestRepository.getProblem("robots"));
    String lDomain = mWriter.writeDomain(lTask.getDomain());

    assertFalse(lDomain.contains(":multi-agent"));
    assertFalse(lDomain.contains(":unfactored-privacy"));
    assertFalse(lDomain.contains(":agent"));
    assertFalse(lDomain.contains(":private"));
    assertTrue(lDomain.contains("(:requirements :typing)"));
    assertTrue(lDomain.contains("\t:parameters (?r1 - robot ?from - location ?to - location)\n"));
  }

  @Test
  public void testReserializationIsIdempotent() throws Exception
  {
    PlanningTask lFirst = reparse(parse(PddlDialect.CLASSICAL,
                                        PddlTestRepository.getDomain("switches"),
                                        PddlTestRepository.getProblem("switches")));
    PlanningTask lSecond = reparse(lFirst);

    assertEquals(mWriter.writeDomain(lFirst.getDomain()), mWriter.writeDomain(lSecond.getDomain()));
    assertEquals(mWriter.writeProblem(lFirst), mWriter.writeProblem(lSecond));
    assertEquals(lFirst.getDomain().getActions(), lSecond.getDomain().getActions());
    assertEquals(lFirst.getDomain().getConstants(), lSecond.getDomain().getConstants());
    assertEquals(lFirst.getProblem().getGroundFunctions(), lSecond.getProblem().getGroundFunctions());
    assertTrue(lSecond.getProblem().hasMetric());
  }

  @Test
  public void testLiteralListLayout() throws Exception
  {
    PlanningTask lTask = parse(PddlDialect.CLASSICAL,
                               "(define (domain d) (:types s)\n" +
                               " (:predicates (on ?x - s))\n" +
                               " (:action noop :parameters (?x - s))\n" +
                               " (:action set :parameters (?x - s) :precondition (not (on ?x)) :effect (on ?x)))",
                               "(define (problem p) (:domain d) (:objects a - s) (:init) (:goal (on a)))");
    String lDomain = mWriter.writeDomain(lTask.getDomain());

    assertTrue(lDomain.contains("\t:precondition (not (on ?x))\n"));
    assertTrue(lDomain.contains("\t:effect (on ?x)\n"));
    assertTrue(lDomain.contains("\t:precondition (and\n\t)\n"));

    String lProblem = mWriter.writeProblem(lTask);
    assertTrue(lProblem.contains("(:goal\n\t(and\n\t\t(on a)\n\t)\n)"));
    assertFalse(lProblem.contains(":metric"));

    PlanningTask lReparsed = reparse(lTask);
    assertTrue(lReparsed.getDomain().getAction("noop").getPrecondition().isEmpty());
    assertTrue(lReparsed.getDomain().getAction("noop").getEffect().isEmpty());
  }
}
