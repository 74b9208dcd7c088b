package org.maplan.base.util.pddl.grammar;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * An <i>atom</i> is a name applied to untyped arguments.  It is used for ground facts, goal conditions and the
 * (lifted) conditions and effects of actions.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlAtom extends PddlLiteral
{
  private final String                name;
  private final ImmutableList<String> body;

  public PddlAtom(String name, List<String> body)
  {
    this.name = name;
    this.body = ImmutableList.copyOf(body);
  }

  public int arity()
  {
    return body.size();
  }

  public String get(int index)
  {
    return body.get(index);
  }

  public String getName()
  {
    return name;
  }

  public List<String> getBody()
  {
    return body;
  }

  @Override
  public boolean isGround()
  {
    for (String lArg : body)
    {
      if (lArg.startsWith("?"))
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public PddlAtom substitute(Map<String, String> xiBinding)
  {
    ImmutableList.Builder<String> lBody = ImmutableList.builder();
    for (String lArg : body)
    {
      String lValue = xiBinding.get(lArg);
      lBody.add(lValue == null ? lArg : lValue);
    }
    return new PddlAtom(name, lBody.build());
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlAtom))
    {
      return false;
    }
    PddlAtom lOther = (PddlAtom)other;
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
    for (String lArg : body)
    {
      sb.append(" " + lArg);
    }
    sb.append(")");
    return sb.toString();
  }
}
