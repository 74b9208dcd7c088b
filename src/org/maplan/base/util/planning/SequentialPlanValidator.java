package org.maplan.base.util.planning;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.math.NumberUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlNot;
import org.maplan.base.util.pddl.grammar.PddlNumericEffect;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.ProblemModel;

/**
 * Checks sequential plans by simulating them from the initial state.
 *
 * Handles positive and negative conditions, equality, add and delete effects (deletes are applied before adds) and
 * constant numeric effects on ground fluents.
 */
public final class SequentialPlanValidator implements PlanChecker
{
  private static final Logger LOGGER = LogManager.getLogger();

  public static final String NAME = "SequentialPlanValidator";

  private static final String EQUALS = "=";

  private static final ProblemKind SUPPORTED_KIND = new ProblemKind(EnumSet.allOf(ProblemKind.Feature.class));

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  public ProblemKind supportedKind()
  {
    return SUPPORTED_KIND;
  }

  @Override
  public boolean supports(ProblemKind xiKind)
  {
    return xiKind.isSubsetOf(SUPPORTED_KIND);
  }

  @Override
  public ValidationResult validate(ClassicalProblem xiProblem, List<ClassicalActionInstance> xiPlan)
  {
    ProblemModel lProblem = xiProblem.getTask().getProblem();
    Set<PddlAtom> lState = new HashSet<>(lProblem.getInit());
    Map<PddlAtom, Double> lFluents = new HashMap<>();
    for (PddlGroundFunctionValue lValue : lProblem.getGroundFunctions())
    {
      lFluents.put(lValue.getFunction(), NumberUtils.createDouble(lValue.getValue()));
    }

    for (int lii = 0; lii < xiPlan.size(); lii++)
    {
      ClassicalActionInstance lInstance = xiPlan.get(lii);
      String lReason = checkParameters(xiProblem, lInstance);
      if (lReason == null)
      {
        lReason = apply(lInstance, lState, lFluents);
      }

      if (lReason != null)
      {
        return invalid("Step " + (lii + 1) + " " + lInstance + ": " + lReason);
      }
    }

    for (PddlLiteral lGoal : lProblem.getGoal())
    {
      if (!holds(lGoal, lState))
      {
        return invalid("Goal " + lGoal + " is not satisfied at the end of the plan");
      }
    }

    LOGGER.debug("Plan of " + xiPlan.size() + " actions is valid");
    List<LogMessage> lMessages = new ArrayList<>();
    lMessages.add(new LogMessage(Level.INFO, "Plan of " + xiPlan.size() + " actions is valid"));
    return new ValidationResult(ValidationResult.Status.VALID, NAME, lMessages, 1);
  }

  private static ValidationResult invalid(String xiReason)
  {
    LOGGER.debug("Plan is invalid: " + xiReason);
    List<LogMessage> lMessages = new ArrayList<>();
    lMessages.add(new LogMessage(Level.INFO, xiReason));
    return new ValidationResult(ValidationResult.Status.INVALID, NAME, lMessages, 1);
  }

  /**
   * @return a reason the instance's objects don't fit the action's parameter types, or null if they do.
   */
  private static String checkParameters(ClassicalProblem xiProblem, ClassicalActionInstance xiInstance)
  {
    List<PddlTypedParameter> lParameters = xiInstance.getAction().getParameters().getBody();
    for (int lii = 0; lii < lParameters.size(); lii++)
    {
      String lObject = xiInstance.getParameters().get(lii);
      String lType = xiProblem.getObjectType(lObject);
      if (lType == null)
      {
        return "unknown object " + lObject;
      }
      if (!xiProblem.getTypes().isSubtypeOf(lType, lParameters.get(lii).getType()))
      {
        return "object " + lObject + " of type " + lType + " can't be bound to " + lParameters.get(lii);
      }
    }
    return null;
  }

  /**
   * Apply an action to the state.
   *
   * @return a reason the action can't be applied, or null if it was.
   */
  private static String apply(ClassicalActionInstance xiInstance,
                              Set<PddlAtom> xoState,
                              Map<PddlAtom, Double> xoFluents)
  {
    PddlAction lAction = xiInstance.getAction();
    Map<String, String> lBinding = xiInstance.getBinding();

    for (PddlLiteral lCondition : lAction.getPrecondition())
    {
      PddlLiteral lGround = lCondition.substitute(lBinding);
      if (!holds(lGround, xoState))
      {
        return "precondition " + lGround + " doesn't hold";
      }
    }

    // Everything is evaluated against the state before the action.
    List<PddlAtom> lDeletes = new ArrayList<>();
    List<PddlAtom> lAdds = new ArrayList<>();
    Map<PddlAtom, Double> lUpdates = new HashMap<>();
    for (PddlLiteral lEffect : lAction.getEffect())
    {
      PddlLiteral lGround = lEffect.substitute(lBinding);
      if (lGround instanceof PddlNot)
      {
        lDeletes.add(((PddlNot)lGround).getBody());
      }
      else if (lGround instanceof PddlAtom)
      {
        lAdds.add((PddlAtom)lGround);
      }
      else
      {
        PddlNumericEffect lNumeric = (PddlNumericEffect)lGround;
        Double lCurrent = lUpdates.containsKey(lNumeric.getFunction()) ? lUpdates.get(lNumeric.getFunction()) :
                                                                         xoFluents.get(lNumeric.getFunction());
        if ((lCurrent == null) && (lNumeric.getOperation() != PddlNumericEffect.Operation.ASSIGN))
        {
          return "fluent " + lNumeric.getFunction() + " has no value";
        }
        double lValue = NumberUtils.createDouble(lNumeric.getValue());
        lUpdates.put(lNumeric.getFunction(),
                     lNumeric.getOperation().apply(lCurrent == null ? 0 : lCurrent, lValue));
      }
    }

    xoState.removeAll(lDeletes);
    xoState.addAll(lAdds);
    xoFluents.putAll(lUpdates);
    return null;
  }

  private static boolean holds(PddlLiteral xiLiteral, Set<PddlAtom> xiState)
  {
    if (xiLiteral instanceof PddlNot)
    {
      return !holds(((PddlNot)xiLiteral).getBody(), xiState);
    }

    PddlAtom lAtom = (PddlAtom)xiLiteral;
    if (lAtom.getName().equals(EQUALS) && (lAtom.arity() == 2))
    {
      return lAtom.get(0).equals(lAtom.get(1));
    }
    return xiState.contains(lAtom);
  }
}
