package org.maplan.base.util.pddl.grammar;

import java.util.Objects;

/**
 * A <i>typed parameter</i> is a name and the type it has been declared with.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlTypedParameter extends Pddl
{
  private final String name;
  private final String type;

  public PddlTypedParameter(String name, String type)
  {
    this.name = name;
    this.type = type;
  }

  public String getName()
  {
    return name;
  }

  public String getType()
  {
    return type;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlTypedParameter))
    {
      return false;
    }
    PddlTypedParameter lOther = (PddlTypedParameter)other;
    return name.equals(lOther.name) && type.equals(lOther.type);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, type);
  }

  @Override
  public String toString()
  {
    return name + " - " + type;
  }
}
