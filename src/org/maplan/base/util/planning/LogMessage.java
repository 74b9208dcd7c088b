package org.maplan.base.util.planning;

import org.apache.logging.log4j.Level;

/**
 * A message produced while validating a plan, to be reported alongside the verdict.
 */
public final class LogMessage
{
  private final Level  mLevel;
  private final String mMessage;

  public LogMessage(Level xiLevel, String xiMessage)
  {
    mLevel = xiLevel;
    mMessage = xiMessage;
  }

  public Level getLevel()
  {
    return mLevel;
  }

  public String getMessage()
  {
    return mMessage;
  }

  @Override
  public String toString()
  {
    return mLevel + ": " + mMessage;
  }
}
