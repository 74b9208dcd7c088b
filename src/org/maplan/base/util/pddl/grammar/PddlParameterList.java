package org.maplan.base.util.pddl.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A <i>parameter list</i> is the ordered list of <i>typed parameters</i> of an action.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlParameterList extends Pddl
{
  private final ImmutableList<PddlTypedParameter> body;

  public PddlParameterList(List<PddlTypedParameter> body)
  {
    this.body = ImmutableList.copyOf(body);
  }

  public int size()
  {
    return body.size();
  }

  public PddlTypedParameter get(int index)
  {
    return body.get(index);
  }

  public List<PddlTypedParameter> getBody()
  {
    return body;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof PddlParameterList) && body.equals(((PddlParameterList)other).body);
  }

  @Override
  public int hashCode()
  {
    return body.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder("(");
    for (int lii = 0; lii < body.size(); lii++)
    {
      if (lii > 0)
      {
        sb.append(" ");
      }
      sb.append(body.get(lii));
    }
    sb.append(")");
    return sb.toString();
  }
}
