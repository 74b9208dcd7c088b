package org.maplan.base.util.pddl.factory.exceptions;

/**
 * Thrown when a problem names a different domain from the one it is being parsed against.  Only raised when strict
 * domain-name checking is configured - otherwise the mismatch is just logged.
 */
public final class DomainMismatchException extends PddlException
{
  private static final long serialVersionUID = 1L;

  public DomainMismatchException(String xiExpected, String xiActual)
  {
    super("Problem refers to domain '" + xiActual + "' but the domain is '" + xiExpected + "'");
  }
}
