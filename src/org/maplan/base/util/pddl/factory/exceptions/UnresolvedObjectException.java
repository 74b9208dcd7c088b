package org.maplan.base.util.pddl.factory.exceptions;

/**
 * Thrown when the type of an object can't be found in either the problem objects or the domain constants.
 */
public final class UnresolvedObjectException extends PddlException
{
  private static final long serialVersionUID = 1L;

  public UnresolvedObjectException(String xiObject)
  {
    super("No type recorded for object '" + xiObject + "'");
  }
}
