package org.maplan.base.util.pddl.grammar;

import java.util.Objects;

/**
 * A <i>ground function value</i> is an initial assignment of a numeric literal to a ground function term, written
 * <code>(= (total-cost) 0)</code>.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlGroundFunctionValue extends Pddl
{
  private final PddlAtom function;
  private final String   value;

  public PddlGroundFunctionValue(PddlAtom function, String value)
  {
    this.function = function;
    this.value = value;
  }

  public PddlAtom getFunction()
  {
    return function;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlGroundFunctionValue))
    {
      return false;
    }
    PddlGroundFunctionValue lOther = (PddlGroundFunctionValue)other;
    return function.equals(lOther.function) && value.equals(lOther.value);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(function, value);
  }

  @Override
  public String toString()
  {
    return "(= " + function + " " + value + ")";
  }
}
