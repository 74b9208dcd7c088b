package org.maplan.base.util.planning.plan;

import java.util.List;
import java.util.Objects;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * One step of a multi-agent plan: an agent performing one of its actions on some objects.
 */
public final class ActionOccurrence
{
  private final String                mActionName;
  private final String                mAgent;
  private final ImmutableList<String> mArguments;

  /**
   * @param xiActionName - the action name, without any agent suffix.
   * @param xiAgent - the agent performing the action.
   * @param xiArguments - the objects bound to the action's ordinary parameters.
   */
  public ActionOccurrence(String xiActionName, String xiAgent, List<String> xiArguments)
  {
    mActionName = xiActionName;
    mAgent = xiAgent;
    mArguments = ImmutableList.copyOf(xiArguments);
  }

  public ActionOccurrence(String xiActionName, String xiAgent, String... xiArguments)
  {
    this(xiActionName, xiAgent, ImmutableList.copyOf(xiArguments));
  }

  public String getActionName()
  {
    return mActionName;
  }

  public String getAgent()
  {
    return mAgent;
  }

  public List<String> getArguments()
  {
    return mArguments;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof ActionOccurrence))
    {
      return false;
    }
    ActionOccurrence lOther = (ActionOccurrence)other;
    return mActionName.equals(lOther.mActionName) &&
           Objects.equals(mAgent, lOther.mAgent) &&
           mArguments.equals(lOther.mArguments);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(mActionName, mAgent, mArguments);
  }

  @Override
  public String toString()
  {
    return mAgent + ":(" + mActionName + (mArguments.isEmpty() ? "" : " " + StringUtils.join(mArguments, ' ')) + ")";
  }
}
