package org.maplan.base.util.pddl.model;

import java.util.List;
import java.util.Objects;

import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlParameterList;

import com.google.common.collect.ImmutableList;

/**
 * A simple (non-temporal) action schema.
 *
 * For an action parsed from MA-PDDL the agent parameter is parameter 0 and the agent type is its declared type.  For
 * an action parsed from classical PDDL there is no agent type and parameter 0 is just the first parameter.
 */
public final class PddlAction
{
  public static final String DEFAULT_DURATION = "1";

  private final String                     mName;
  private final PddlParameterList          mParameters;
  private final ImmutableList<PddlLiteral> mPrecondition;
  private final ImmutableList<PddlLiteral> mEffect;
  private final String                     mDuration;
  private final String                     mAgentType;

  /**
   * Create an action.
   *
   * @param xiName - the action name.
   * @param xiParameters - all parameters, including any agent parameter.
   * @param xiPrecondition - precondition literals (implicitly conjoined).
   * @param xiEffect - effect literals.
   * @param xiDuration - duration, as written.  Carried but never interpreted.
   * @param xiAgentType - the agent type, or null for a classical action.
   */
  public PddlAction(String xiName,
                    PddlParameterList xiParameters,
                    List<PddlLiteral> xiPrecondition,
                    List<PddlLiteral> xiEffect,
                    String xiDuration,
                    String xiAgentType)
  {
    mName = xiName;
    mParameters = xiParameters;
    mPrecondition = ImmutableList.copyOf(xiPrecondition);
    mEffect = ImmutableList.copyOf(xiEffect);
    mDuration = xiDuration;
    mAgentType = xiAgentType;
  }

  public String getName()
  {
    return mName;
  }

  public PddlParameterList getParameters()
  {
    return mParameters;
  }

  public List<PddlLiteral> getPrecondition()
  {
    return mPrecondition;
  }

  public List<PddlLiteral> getEffect()
  {
    return mEffect;
  }

  public String getDuration()
  {
    return mDuration;
  }

  /**
   * @return the agent type, or null if this action was parsed from classical PDDL.
   */
  public String getAgentType()
  {
    return mAgentType;
  }

  /**
   * Structural equality ignores the agent type and the duration, so that an MA-PDDL action equals its classical
   * counterpart.
   */
  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlAction))
    {
      return false;
    }
    PddlAction lOther = (PddlAction)other;
    return mName.equals(lOther.mName) &&
           mParameters.equals(lOther.mParameters) &&
           mPrecondition.equals(lOther.mPrecondition) &&
           mEffect.equals(lOther.mEffect);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(mName, mParameters, mPrecondition, mEffect);
  }

  @Override
  public String toString()
  {
    return mName + mParameters;
  }
}
