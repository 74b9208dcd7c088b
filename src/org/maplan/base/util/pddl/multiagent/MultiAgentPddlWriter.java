package org.maplan.base.util.pddl.multiagent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.SetMultimap;

/**
 * Writes a {@link MultiAgentProblem} as unfactored MA-PDDL.
 *
 * Every agent gets its own copy of each of its actions, named {@code <action>_<agent>}, whose :agent parameter is
 * {@code ?<agent>}.  References to the action's agent variable are rewritten to that parameter.
 */
public final class MultiAgentPddlWriter
{
  /**
   * Separator between the action name and the agent name in the name of a per-agent action.
   */
  public static final String AGENT_SEPARATOR = "_";

  private static final String[] MULTI_AGENT_REQUIREMENTS = {"multi-agent", "unfactored-privacy"};

  public String writeDomain(MultiAgentProblem xiProblem)
  {
    StringBuilder lText = new StringBuilder();
    lText.append("(define (domain " + xiProblem.getDomainName() + ")\n");

    lText.append("\t(:requirements");
    for (String lRequirement : MULTI_AGENT_REQUIREMENTS)
    {
      lText.append(" :" + lRequirement);
    }
    for (String lRequirement : xiProblem.getRequirements())
    {
      lText.append(" :" + lRequirement);
    }
    lText.append(")\n");

    TypeHierarchy lTypes = xiProblem.getTypes();
    lText.append("(:types\n");
    for (String lSupertype : lTypes.getSupertypes())
    {
      lText.append("\t" + StringUtils.join(lTypes.getSubtypes(lSupertype), ' ') + " - " + lSupertype + "\n");
    }
    lText.append(")\n");

    lText.append("(:predicates\n");
    for (PddlPredicateSignature lPredicate : xiProblem.getPredicates())
    {
      lText.append("\t" + lPredicate + "\n");
    }
    for (Agent lAgent : xiProblem.getAgents())
    {
      if (!lAgent.getPrivatePredicates().isEmpty())
      {
        lText.append("\t(:private " + agentParameter(lAgent) + "\n");
        for (PddlPredicateSignature lPredicate : lAgent.getPrivatePredicates())
        {
          lText.append("\t\t" + lPredicate + "\n");
        }
        lText.append("\t)\n");
      }
    }
    lText.append(")\n");

    if (!xiProblem.getFunctions().isEmpty())
    {
      lText.append("(:functions\n");
      for (PddlFunctionSignature lFunction : xiProblem.getFunctions())
      {
        lText.append("\t" + lFunction + "\n");
      }
      lText.append(")\n");
    }

    for (Agent lAgent : xiProblem.getAgents())
    {
      for (AgentAction lAction : lAgent.getActions())
      {
        lText.append("\n");
        writeAction(lAgent, lAction, lText);
      }
    }

    lText.append(")\n");
    return lText.toString();
  }

  private static String agentParameter(Agent xiAgent)
  {
    return "?" + xiAgent.getName() + " - " + xiAgent.getType();
  }

  /**
   * @return the variable standing for the agent in one of its actions.  This is <code>?name</code> unless the action
   *         already has a parameter of that name, in which case a numeric suffix is added.
   */
  static String agentVariable(Agent xiAgent, AgentAction xiAction)
  {
    Set<String> lTaken = new HashSet<>();
    for (PddlTypedParameter lParameter : xiAction.getParameters().getBody())
    {
      lTaken.add(lParameter.getName());
    }

    String lVariable = "?" + xiAgent.getName();
    for (int lSuffix = 1; lTaken.contains(lVariable); lSuffix++)
    {
      lVariable = "?" + xiAgent.getName() + AGENT_SEPARATOR + lSuffix;
    }
    return lVariable;
  }

  private static void writeAction(Agent xiAgent, AgentAction xiAction, StringBuilder xoText)
  {
    String lAgentVariable = agentVariable(xiAgent, xiAction);
    Map<String, String> lBinding = ImmutableMap.of(xiAction.getAgentVariable(), lAgentVariable);

    xoText.append("(:action " + xiAction.getName() + AGENT_SEPARATOR + xiAgent.getName() + "\n");
    xoText.append("\t:agent " + lAgentVariable + " - " + xiAgent.getType() + "\n");
    xoText.append("\t:parameters " + xiAction.getParameters() + "\n");
    writeConjunction(":precondition", substitute(xiAction.getPrecondition(), lBinding), xoText);
    writeConjunction(":effect", substitute(xiAction.getEffect(), lBinding), xoText);
    xoText.append(")\n");
  }

  private static List<PddlLiteral> substitute(List<PddlLiteral> xiLiterals, Map<String, String> xiBinding)
  {
    List<PddlLiteral> lResult = new ArrayList<>(xiLiterals.size());
    for (PddlLiteral lLiteral : xiLiterals)
    {
      lResult.add(lLiteral.substitute(xiBinding));
    }
    return lResult;
  }

  private static void writeConjunction(String xiKeyword, List<PddlLiteral> xiLiterals, StringBuilder xoText)
  {
    xoText.append("\t" + xiKeyword + " (and\n");
    for (PddlLiteral lLiteral : xiLiterals)
    {
      xoText.append("\t\t" + lLiteral + "\n");
    }
    xoText.append("\t)\n");
  }

  public String writeProblem(MultiAgentProblem xiProblem)
  {
    StringBuilder lText = new StringBuilder();
    lText.append("(define (problem " + xiProblem.getName() + ") ");
    lText.append("(:domain " + xiProblem.getDomainName() + ")\n");

    lText.append("(:objects\n");
    for (Agent lAgent : xiProblem.getAgents())
    {
      lText.append("\t" + lAgent.getName() + " - " + lAgent.getType() + "\n");
    }
    SetMultimap<String, String> lObjects = xiProblem.getObjects();
    for (String lType : lObjects.keySet())
    {
      lText.append("\t" + StringUtils.join(lObjects.get(lType), ' ') + " - " + lType + "\n");
    }
    lText.append(")\n");

    lText.append("(:init\n");
    for (Object lFact : xiProblem.getInit())
    {
      lText.append("\t" + lFact + "\n");
    }
    for (Object lValue : xiProblem.getInitFunctions())
    {
      lText.append("\t" + lValue + "\n");
    }
    lText.append(")\n");

    lText.append("(:goal (and\n");
    for (PddlLiteral lGoal : xiProblem.getGoal())
    {
      lText.append("\t" + lGoal + "\n");
    }
    lText.append("))\n");

    if (xiProblem.hasMetric())
    {
      lText.append("(:metric minimize (total-cost))\n");
    }

    lText.append(")\n");
    return lText.toString();
  }
}
