package org.maplan.base.util.pddl.factory.exceptions;

/**
 * Abstract class for exceptions that are a result of bad PDDL.
 */
public abstract class PddlException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected PddlException(String xiMessage)
  {
    super(xiMessage);
  }
}
