package org.maplan.base.validator.exceptions;

/**
 * Thrown when a plan step's agent or arguments can't be bound to the parameters of its classical action.
 */
public final class ParameterTypeMismatchException extends PlanConversionException
{
  private static final long serialVersionUID = 1L;

  public ParameterTypeMismatchException(String xiMessage)
  {
    super(xiMessage);
  }
}
