package org.maplan.base.util.pddl.grammar;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A <i>function signature</i> declares a numeric function.  The parameter tokens are kept exactly as declared (they
 * may or may not be typed) and the function is always of type <code>number</code>.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlFunctionSignature extends Pddl
{
  public static final String NUMBER_TYPE = "number";

  private final String                name;
  private final ImmutableList<String> parameters;

  public PddlFunctionSignature(String name, List<String> parameters)
  {
    this.name = name;
    this.parameters = ImmutableList.copyOf(parameters);
  }

  public String getName()
  {
    return name;
  }

  public List<String> getParameters()
  {
    return parameters;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlFunctionSignature))
    {
      return false;
    }
    PddlFunctionSignature lOther = (PddlFunctionSignature)other;
    return name.equals(lOther.name) && parameters.equals(lOther.parameters);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, parameters);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    sb.append("(" + name);
    for (String lParam : parameters)
    {
      sb.append(" " + lParam);
    }
    sb.append(") - " + NUMBER_TYPE);
    return sb.toString();
  }
}
