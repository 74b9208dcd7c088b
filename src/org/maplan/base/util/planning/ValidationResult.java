package org.maplan.base.util.planning;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The verdict on a plan.
 */
public final class ValidationResult
{
  /**
   * Whether the plan achieved the goal.
   */
  public static enum Status
  {
    VALID,
    INVALID;
  }

  private final Status                    mStatus;
  private final String                    mEngineName;
  private final ImmutableList<LogMessage> mLogMessages;
  private final int                       mLinearizationsChecked;

  /**
   * @param xiStatus - the verdict.
   * @param xiEngineName - the name of whatever produced the verdict.
   * @param xiLogMessages - supporting messages, e.g. the reason a plan is invalid.
   * @param xiLinearizationsChecked - the number of sequential plans checked to reach the verdict.
   */
  public ValidationResult(Status xiStatus,
                          String xiEngineName,
                          List<LogMessage> xiLogMessages,
                          int xiLinearizationsChecked)
  {
    mStatus = xiStatus;
    mEngineName = xiEngineName;
    mLogMessages = ImmutableList.copyOf(xiLogMessages);
    mLinearizationsChecked = xiLinearizationsChecked;
  }

  public Status getStatus()
  {
    return mStatus;
  }

  public boolean isValid()
  {
    return mStatus == Status.VALID;
  }

  public String getEngineName()
  {
    return mEngineName;
  }

  public List<LogMessage> getLogMessages()
  {
    return mLogMessages;
  }

  public int getLinearizationsChecked()
  {
    return mLinearizationsChecked;
  }

  @Override
  public String toString()
  {
    return mEngineName + ": " + mStatus + " after " + mLinearizationsChecked + " plan(s) " + mLogMessages;
  }
}
