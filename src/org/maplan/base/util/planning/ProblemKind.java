package org.maplan.base.util.planning;

import java.util.EnumSet;
import java.util.Set;

import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlNot;
import org.maplan.base.util.pddl.grammar.PddlNumericEffect;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The set of language features that a planning problem uses, or that a plan checker understands.
 */
public final class ProblemKind
{
  /**
   * Individual features.
   */
  public static enum Feature
  {
    /**
     * Objects are typed.
     */
    TYPING,

    /**
     * At least one type descends from a type other than the root.
     */
    HIERARCHICAL_TYPING,

    /**
     * Negated literals in a precondition or the goal.
     */
    NEGATIVE_CONDITIONS,

    /**
     * (= a b) in a precondition or the goal.
     */
    EQUALITIES,

    /**
     * Numeric effects on a fluent other than total-cost.
     */
    NUMERIC_FLUENTS,

    /**
     * Numeric effects on total-cost, or a total-cost metric.
     */
    ACTION_COSTS;
  }

  /**
   * The function through which action costs are recorded.
   */
  public static final String TOTAL_COST = "total-cost";

  private static final String EQUALS = "=";

  private final ImmutableSet<Feature> mFeatures;

  public ProblemKind(Set<Feature> xiFeatures)
  {
    mFeatures = Sets.immutableEnumSet(xiFeatures);
  }

  /**
   * @return the kind of a parsed problem.
   *
   * @param xiTask - the domain and problem.
   */
  public static ProblemKind of(PlanningTask xiTask)
  {
    Set<Feature> lFeatures = EnumSet.noneOf(Feature.class);
    DomainModel lDomain = xiTask.getDomain();

    TypeHierarchy lTypes = lDomain.getTypes();
    if (lDomain.getRequirements().contains("typing") || (lTypes.getKnownTypes().size() > 1))
    {
      lFeatures.add(Feature.TYPING);
    }
    if (lTypes.isHierarchical())
    {
      lFeatures.add(Feature.HIERARCHICAL_TYPING);
    }

    for (PddlAction lAction : lDomain.getActions())
    {
      addConditionFeatures(lAction.getPrecondition(), lFeatures);
      for (PddlLiteral lEffect : lAction.getEffect())
      {
        if (lEffect instanceof PddlNumericEffect)
        {
          boolean lCost = ((PddlNumericEffect)lEffect).getFunction().getName().equals(TOTAL_COST);
          lFeatures.add(lCost ? Feature.ACTION_COSTS : Feature.NUMERIC_FLUENTS);
        }
      }
    }
    addConditionFeatures(xiTask.getProblem().getGoal(), lFeatures);

    for (PddlGroundFunctionValue lValue : xiTask.getProblem().getGroundFunctions())
    {
      if (!lValue.getFunction().getName().equals(TOTAL_COST))
      {
        lFeatures.add(Feature.NUMERIC_FLUENTS);
      }
    }
    if (xiTask.getProblem().hasMetric())
    {
      lFeatures.add(Feature.ACTION_COSTS);
    }

    return new ProblemKind(lFeatures);
  }

  private static void addConditionFeatures(Iterable<PddlLiteral> xiLiterals, Set<Feature> xoFeatures)
  {
    for (PddlLiteral lLiteral : xiLiterals)
    {
      PddlAtom lAtom;
      if (lLiteral instanceof PddlNot)
      {
        xoFeatures.add(Feature.NEGATIVE_CONDITIONS);
        lAtom = ((PddlNot)lLiteral).getBody();
      }
      else if (lLiteral instanceof PddlAtom)
      {
        lAtom = (PddlAtom)lLiteral;
      }
      else
      {
        continue;
      }

      if (lAtom.getName().equals(EQUALS))
      {
        xoFeatures.add(Feature.EQUALITIES);
      }
    }
  }

  public Set<Feature> getFeatures()
  {
    return mFeatures;
  }

  public boolean has(Feature xiFeature)
  {
    return mFeatures.contains(xiFeature);
  }

  /**
   * @return whether every feature of this kind is also in the other kind.
   *
   * @param xiOther - the (typically larger) kind.
   */
  public boolean isSubsetOf(ProblemKind xiOther)
  {
    return xiOther.mFeatures.containsAll(mFeatures);
  }

  /**
   * @return the features of this kind that the other kind lacks.
   *
   * @param xiOther - the other kind.
   */
  public Set<Feature> missingFrom(ProblemKind xiOther)
  {
    return Sets.difference(mFeatures, xiOther.mFeatures);
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof ProblemKind) && mFeatures.equals(((ProblemKind)other).mFeatures);
  }

  @Override
  public int hashCode()
  {
    return mFeatures.hashCode();
  }

  @Override
  public String toString()
  {
    return mFeatures.toString();
  }
}
