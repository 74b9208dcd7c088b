package org.maplan.base.util.pddl.factory.exceptions;

import java.util.Set;

/**
 * Thrown when a type is referenced before it has been declared.
 */
public final class UnknownTypeException extends PddlException
{
  private static final long serialVersionUID = 1L;

  private final String mType;

  public UnknownTypeException(String xiType, Set<String> xiKnownTypes)
  {
    super("Unknown type '" + xiType + "' (known types: " + xiKnownTypes + ")");
    mType = xiType;
  }

  public String getType()
  {
    return mType;
  }
}
