package org.maplan.base.util.pddl.writer;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.maplan.base.util.pddl.factory.exceptions.UnresolvedObjectException;
import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableSet;

/**
 * Writes a parsed (MA-)PDDL domain and problem out as classical PDDL.
 *
 * The agent parameter of each action is written as an ordinary first parameter and the multi-agent-only requirement
 * flags are dropped.  The output never contains comments and always parses back into an equal model.
 */
public final class ClassicalPddlWriter
{
  /**
   * Requirement flags that only make sense in MA-PDDL.
   */
  public static final Set<String> MULTI_AGENT_REQUIREMENTS = ImmutableSet.of("multi-agent", "unfactored-privacy");

  /**
   * @return the classical PDDL text of a domain.
   *
   * @param xiDomain - the domain.
   */
  public String writeDomain(DomainModel xiDomain)
  {
    StringBuilder lText = new StringBuilder();
    lText.append("(define (domain " + xiDomain.getName() + ")\n");

    lText.append("\t(:requirements");
    for (String lRequirement : xiDomain.getRequirements())
    {
      if (!MULTI_AGENT_REQUIREMENTS.contains(lRequirement))
      {
        lText.append(" :" + lRequirement);
      }
    }
    lText.append(")\n");

    TypeHierarchy lTypes = xiDomain.getTypes();
    lText.append("(:types\n");
    for (String lSupertype : lTypes.getSupertypes())
    {
      lText.append("\t" + StringUtils.join(lTypes.getSubtypes(lSupertype), ' ') + " - " + lSupertype + "\n");
    }
    lText.append(")\n");

    if (!xiDomain.getConstants().isEmpty())
    {
      lText.append("(:constants\n");
      for (String lType : xiDomain.getConstants().keySet())
      {
        lText.append("\t" + StringUtils.join(xiDomain.getConstants().get(lType), ' ') + " - " + lType + "\n");
      }
      lText.append(")\n");
    }

    lText.append("(:predicates\n");
    for (PddlPredicateSignature lPredicate : xiDomain.getPredicates())
    {
      lText.append("\t" + lPredicate + "\n");
    }
    lText.append(")\n");

    if (!xiDomain.getFunctions().isEmpty())
    {
      lText.append("(:functions\n");
      for (PddlFunctionSignature lFunction : xiDomain.getFunctions())
      {
        lText.append("\t" + lFunction + "\n");
      }
      lText.append(")\n");
    }

    for (PddlAction lAction : xiDomain.getActions())
    {
      lText.append("\n");
      writeAction(lAction, lText);
    }

    lText.append(")\n");
    return lText.toString();
  }

  private static void writeAction(PddlAction xiAction, StringBuilder xoText)
  {
    xoText.append("(:action " + xiAction.getName() + "\n");
    xoText.append("\t:parameters " + xiAction.getParameters() + "\n");
    writeConjunction(":precondition", xiAction.getPrecondition(), xoText);
    writeConjunction(":effect", xiAction.getEffect(), xoText);
    xoText.append(")\n");
  }

  /**
   * Write a literal list.  A single literal is written bare; anything else is wrapped in (and ...).
   */
  private static void writeConjunction(String xiKeyword, List<PddlLiteral> xiLiterals, StringBuilder xoText)
  {
    if (xiLiterals.size() == 1)
    {
      xoText.append("\t" + xiKeyword + " " + xiLiterals.get(0) + "\n");
      return;
    }

    xoText.append("\t" + xiKeyword + " (and\n");
    for (PddlLiteral lLiteral : xiLiterals)
    {
      xoText.append("\t\t" + lLiteral + "\n");
    }
    xoText.append("\t)\n");
  }

  /**
   * @return the classical PDDL text of a problem.
   *
   * @param xiTask - the domain and problem.
   *
   * @throws UnresolvedObjectException if the type of an object can't be found.
   */
  public String writeProblem(PlanningTask xiTask) throws UnresolvedObjectException
  {
    ProblemModel lProblem = xiTask.getProblem();
    StringBuilder lText = new StringBuilder();
    lText.append("(define (problem " + lProblem.getName() + ") ");
    lText.append("(:domain " + xiTask.getDomain().getName() + ")\n");

    lText.append("(:objects\n");
    for (String lObject : xiTask.getObjects())
    {
      String lType = xiTask.getTypeOfObject(lObject);
      if (lType == null)
      {
        throw new UnresolvedObjectException(lObject);
      }
      lText.append("\t" + lObject + " - " + lType + "\n");
    }
    lText.append(")\n");

    lText.append("(:init\n");
    appendAll(lProblem.getInit(), lText);
    appendAll(lProblem.getGroundFunctions(), lText);
    lText.append(")\n");

    lText.append("(:goal\n\t(and\n");
    for (PddlLiteral lGoal : lProblem.getGoal())
    {
      lText.append("\t\t" + lGoal + "\n");
    }
    lText.append("\t)\n)\n");

    if (lProblem.hasMetric())
    {
      lText.append("(:metric minimize (total-cost))\n");
    }

    lText.append(")\n");
    return lText.toString();
  }

  private static void appendAll(Collection<?> xiItems, StringBuilder xoText)
  {
    for (Object lItem : xiItems)
    {
      xoText.append("\t" + lItem + "\n");
    }
  }
}
