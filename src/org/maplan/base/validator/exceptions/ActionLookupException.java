package org.maplan.base.validator.exceptions;

/**
 * Thrown when the classical problem has no action for an agent's use of a multi-agent action.
 */
public final class ActionLookupException extends PlanConversionException
{
  private static final long serialVersionUID = 1L;

  private final String mClassicalName;

  public ActionLookupException(String xiClassicalName, String xiActionName, String xiAgent)
  {
    super("No matching action " + xiClassicalName + " for " + xiActionName + " performed by " + xiAgent);
    mClassicalName = xiClassicalName;
  }

  /**
   * @return the name of the classical action that was looked for.
   */
  public String getClassicalName()
  {
    return mClassicalName;
  }
}
