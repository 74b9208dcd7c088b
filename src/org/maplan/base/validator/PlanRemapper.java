package org.maplan.base.validator;

import java.util.ArrayList;
import java.util.List;

import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.multiagent.MultiAgentPddlWriter;
import org.maplan.base.util.planning.ClassicalActionInstance;
import org.maplan.base.util.planning.ClassicalProblem;
import org.maplan.base.util.planning.plan.ActionOccurrence;
import org.maplan.base.validator.exceptions.ActionLookupException;
import org.maplan.base.validator.exceptions.ParameterTypeMismatchException;
import org.maplan.base.validator.exceptions.PlanConversionException;

/**
 * Maps multi-agent plan steps onto the actions of the classical problem.
 *
 * An agent's use of action <code>a</code> becomes the classical action <code>a_agent</code>, with the agent bound to
 * its first parameter and the step's arguments bound to the rest.
 */
public final class PlanRemapper
{
  private final ClassicalProblem mProblem;

  public PlanRemapper(ClassicalProblem xiProblem)
  {
    mProblem = xiProblem;
  }

  /**
   * Map a single step.
   *
   * @param xiOccurrence - the step.
   *
   * @return the classical action instance.
   *
   * @throws ActionLookupException if there's no classical action for the step.
   * @throws ParameterTypeMismatchException if the agent or arguments don't fit the classical action.
   */
  public ClassicalActionInstance remap(ActionOccurrence xiOccurrence) throws PlanConversionException
  {
    String lAgent = xiOccurrence.getAgent();
    if (lAgent == null)
    {
      throw new ParameterTypeMismatchException("Action " + xiOccurrence.getActionName() +
                                               " does not have an associated agent");
    }

    String lName = xiOccurrence.getActionName() + MultiAgentPddlWriter.AGENT_SEPARATOR + lAgent;
    PddlAction lAction = mProblem.getAction(lName);
    if (lAction == null)
    {
      throw new ActionLookupException(lName, xiOccurrence.getActionName(), lAgent);
    }

    List<PddlTypedParameter> lParameters = lAction.getParameters().getBody();
    if (lParameters.size() != xiOccurrence.getArguments().size() + 1)
    {
      throw new ParameterTypeMismatchException(lName + " takes " + lParameters.size() + " parameters (including the " +
                                               "agent) but " + xiOccurrence + " supplies " +
                                               (xiOccurrence.getArguments().size() + 1));
    }

    String lAgentType = mProblem.getObjectType(lAgent);
    if (lAgentType == null)
    {
      throw new ParameterTypeMismatchException("Unknown agent " + lAgent + " in " + xiOccurrence);
    }
    String lParameterType = lParameters.get(0).getType();
    if (!mProblem.getTypes().isSubtypeOf(lAgentType, lParameterType))
    {
      throw new ParameterTypeMismatchException("Agent " + lAgent + " has type " + lAgentType + " but " + lName +
                                               " expects " + lParameterType);
    }

    List<String> lBound = new ArrayList<>(lParameters.size());
    lBound.add(lAgent);
    lBound.addAll(xiOccurrence.getArguments());
    return new ClassicalActionInstance(lAction, lBound);
  }

  /**
   * Map a sequence of steps.
   *
   * @param xiOccurrences - the steps.
   *
   * @return the classical action instances, in the same order.
   *
   * @throws PlanConversionException if any step can't be mapped.
   */
  public List<ClassicalActionInstance> remap(List<ActionOccurrence> xiOccurrences) throws PlanConversionException
  {
    List<ClassicalActionInstance> lInstances = new ArrayList<>(xiOccurrences.size());
    for (ActionOccurrence lOccurrence : xiOccurrences)
    {
      lInstances.add(remap(lOccurrence));
    }
    return lInstances;
  }
}
