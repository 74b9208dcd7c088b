package org.maplan.base.util.pddl.grammar;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A <i>predicate signature</i> is the declaration of a predicate: its name and its typed parameters.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlPredicateSignature extends Pddl
{
  private final String                            name;
  private final ImmutableList<PddlTypedParameter> body;

  public PddlPredicateSignature(String name, List<PddlTypedParameter> body)
  {
    this.name = name;
    this.body = ImmutableList.copyOf(body);
  }

  public int arity()
  {
    return body.size();
  }

  public String getName()
  {
    return name;
  }

  public List<PddlTypedParameter> getBody()
  {
    return body;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlPredicateSignature))
    {
      return false;
    }
    PddlPredicateSignature lOther = (PddlPredicateSignature)other;
    return name.equals(lOther.name) && body.equals(lOther.body);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, body);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    sb.append("(" + name);
    for (PddlTypedParameter lParam : body)
    {
      sb.append(" " + lParam);
    }
    sb.append(")");
    return sb.toString();
  }
}
