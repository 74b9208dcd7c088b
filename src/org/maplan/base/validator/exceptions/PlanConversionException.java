package org.maplan.base.validator.exceptions;

/**
 * Abstract class for exceptions that arise when a multi-agent plan step can't be mapped onto the classical problem.
 */
public abstract class PlanConversionException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected PlanConversionException(String xiMessage)
  {
    super(xiMessage);
  }
}
