package org.maplan.base.util.pddl.factory.exceptions;

/**
 * Thrown when PDDL text is syntactically malformed: a bad header, unbalanced parentheses or a malformed
 * requirement, parameter or literal.
 */
public final class PddlFormatException extends PddlException
{
  private static final long serialVersionUID = 1L;

  public PddlFormatException(String xiMessage)
  {
    super(xiMessage);
  }
}
