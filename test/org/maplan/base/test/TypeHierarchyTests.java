package org.maplan.base.test;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.util.pddl.factory.DomainParser;
import org.maplan.base.util.pddl.factory.PddlDialect;
import org.maplan.base.util.pddl.factory.ProblemParser;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableSet;

public class TypeHierarchyTests extends Assert
{
  private static final String DOMAIN = "(define (domain d)\n" +
                                       " (:requirements :typing)\n" +
                                       " (:types agent - object robot - agent location)\n" +
                                       " (:predicates (at ?a - agent ?l - location)))";

  private static final String PROBLEM = "(define (problem p) (:domain d)\n" +
                                        " (:objects r1 - robot l1 - location)\n" +
                                        " (:init (at r1 l1))\n" +
                                        " (:goal (and (at r1 l1))))";

  @Test
  public void testObjectsOfTypeIncludeDescendants() throws Exception
  {
    DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(DOMAIN);
    ProblemModel lProblem = new ProblemParser(false).parse(PROBLEM, lDomain);
    PlanningTask lTask = new PlanningTask(lDomain, lProblem);

    assertEquals(ImmutableSet.of("r1"), lTask.getObjectsOfType("agent"));
    assertEquals(ImmutableSet.of("r1"), lTask.getObjectsOfType("robot"));
    assertEquals(ImmutableSet.of("r1", "l1"), lTask.getObjectsOfType(TypeHierarchy.ROOT_TYPE));
    assertEquals("robot", lTask.getTypeOfObject("r1"));
    assertNull(lTask.getTypeOfObject("r2"));
  }

  @Test
  public void testSubtypeClosure()
  {
    TypeHierarchy lTypes = new TypeHierarchy.Builder().declare("agent", "object")
                                                      .declare("robot", "agent")
                                                      .declare("drone", "agent")
                                                      .declareTopLevel("location")
                                                      .build();

    assertTrue(lTypes.isSubtypeOf("robot", "agent"));
    assertTrue(lTypes.isSubtypeOf("robot", "robot"));
    assertTrue(lTypes.isSubtypeOf("robot", TypeHierarchy.ROOT_TYPE));
    assertFalse(lTypes.isSubtypeOf("agent", "robot"));
    assertFalse(lTypes.isSubtypeOf("location", "agent"));
    assertEquals(ImmutableSet.of("agent", "robot", "drone"), lTypes.getDescendants("agent"));
    assertTrue(lTypes.isHierarchical());
  }

  @Test
  public void testUndeclaredSupertypeGoesUnderRoot()
  {
    TypeHierarchy lTypes = new TypeHierarchy.Builder().declare("truck", "vehicle").build();

    assertTrue(lTypes.isKnown("vehicle"));
    assertTrue(lTypes.isKnown(TypeHierarchy.ROOT_TYPE));
    assertEquals(ImmutableSet.of("vehicle"), lTypes.getSubtypes(TypeHierarchy.ROOT_TYPE));
    assertTrue(lTypes.isSubtypeOf("truck", TypeHierarchy.ROOT_TYPE));
  }

  @Test
  public void testFlatHierarchy()
  {
    TypeHierarchy lTypes = new TypeHierarchy.Builder().declareTopLevel("a").declareTopLevel("b").build();
    assertFalse(lTypes.isHierarchical());
    assertEquals(ImmutableSet.of(TypeHierarchy.ROOT_TYPE), lTypes.getSupertypes());
  }
}
