package org.maplan.base.test;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.util.pddl.factory.DomainParser;
import org.maplan.base.util.pddl.factory.PddlDialect;
import org.maplan.base.util.pddl.factory.ProblemParser;
import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlNot;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;
import org.maplan.base.util.pddl.multiagent.MultiAgentProblem;

import com.google.common.collect.ImmutableSet;

public class MultiAgentPddlWriterTests extends Assert
{
  @Test
  public void testActionsAreWrittenPerAgent() throws Exception
  {
    MultiAgentProblem lSource = RobotProblems.twoRobots();
    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(lSource.writeDomain());

    assertEquals("robots", lDomain.getName());
    assertTrue(lDomain.getRequirements().contains("multi-agent"));
    assertEquals(2, lDomain.getActions().size());

    PddlAction lMove = lDomain.getAction("move_r2");
    assertEquals("robot", lMove.getAgentType());
    assertEquals(new PddlTypedParameter("?r2", "robot"), lMove.getParameters().get(0));
    assertEquals(3, lMove.getParameters().size());
    assertEquals(new PddlAtom("at", Arrays.asList("?r2", "?from")), lMove.getPrecondition().get(0));
    assertEquals(new PddlNot(new PddlAtom("at", Arrays.asList("?r2", "?from"))), lMove.getEffect().get(0));
  }

  @Test
  public void testAgentNamedAfterParameter() throws Exception
  {
    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(RobotProblems.robotNamedTo().writeDomain());

    PddlAction lMove = lDomain.getAction("move_to");
    assertEquals(new PddlTypedParameter("?to_1", "robot"), lMove.getParameters().get(0));
    assertEquals(new PddlTypedParameter("?to", "location"), lMove.getParameters().get(2));
    assertEquals(new PddlAtom("at", Arrays.asList("?to_1", "?from")), lMove.getPrecondition().get(0));
    assertEquals(new PddlAtom("at", Arrays.asList("?to_1", "?to")), lMove.getEffect().get(1));
  }

  @Test
  public void testAgentsAreObjects() throws Exception
  {
    MultiAgentProblem lSource = RobotProblems.twoRobots();
    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(lSource.writeDomain());
    ProblemModel lProblem = new ProblemParser(true).parse(lSource.writeProblem(), lDomain);
    PlanningTask lTask = new PlanningTask(lDomain, lProblem);

    assertEquals(ImmutableSet.of("r1", "r2"), lTask.getAgents());
    assertEquals(ImmutableSet.of("r1", "r2"), lTask.getObjectsOfType("agent"));
    assertEquals(ImmutableSet.of("l1", "l2", "l3"), lProblem.getObjects().get("location"));
    assertEquals(3, lProblem.getInit().size());
    assertEquals(2, lProblem.getGoal().size());
  }

  @Test
  public void testPrivatePredicates() throws Exception
  {
    MultiAgentProblem lSource = RobotProblems.singleRobot();
    lSource.getAgents().get(0).addPrivatePredicate(
        new PddlPredicateSignature("charged", Arrays.asList(new PddlTypedParameter("?r", "robot"))));

    String lText = lSource.writeDomain();
    assertTrue(lText.contains("(:private ?r1 - robot"));

    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(lText);
    assertEquals(2, lDomain.getPredicates().size());
    assertEquals("charged", lDomain.getPredicates().get(1).getName());
  }

  @Test
  public void testMetric() throws Exception
  {
    MultiAgentProblem lSource = RobotProblems.singleRobot().setMetric();
    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(lSource.writeDomain());
    assertTrue(new ProblemParser(false).parse(lSource.writeProblem(), lDomain).hasMetric());
  }
}
