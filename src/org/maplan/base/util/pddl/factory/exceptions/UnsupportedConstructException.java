package org.maplan.base.util.pddl.factory.exceptions;

/**
 * Thrown for valid PDDL that this library deliberately doesn't handle (quantifiers, disjunction, conditional
 * effects, numeric conditions, derived predicates...).
 */
public final class UnsupportedConstructException extends PddlException
{
  private static final long serialVersionUID = 1L;

  public UnsupportedConstructException(String xiMessage)
  {
    super(xiMessage);
  }
}
