package org.maplan.base.validator;

/**
 * Thrown when a validation request can't reach a verdict.  An invalid plan is a result, never an exception.
 */
public final class ValidatorException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final ValidationStage mStage;

  public ValidatorException(ValidationStage xiStage, String xiMessage)
  {
    super(xiStage + ": " + xiMessage);
    mStage = xiStage;
  }

  public ValidatorException(ValidationStage xiStage, String xiMessage, Throwable xiCause)
  {
    super(xiStage + ": " + xiMessage, xiCause);
    mStage = xiStage;
  }

  /**
   * @return the stage the request had reached when it failed.
   */
  public ValidationStage getStage()
  {
    return mStage;
  }
}
