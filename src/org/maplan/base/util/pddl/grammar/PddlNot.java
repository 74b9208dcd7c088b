package org.maplan.base.util.pddl.grammar;

import java.util.Map;

/**
 * A <i>not</i> is a negated <i>atom</i>.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlNot extends PddlLiteral
{
  private final PddlAtom body;

  public PddlNot(PddlAtom body)
  {
    this.body = body;
  }

  public PddlAtom getBody()
  {
    return body;
  }

  @Override
  public boolean isGround()
  {
    return body.isGround();
  }

  @Override
  public PddlNot substitute(Map<String, String> xiBinding)
  {
    return new PddlNot(body.substitute(xiBinding));
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof PddlNot) && body.equals(((PddlNot)other).body);
  }

  @Override
  public int hashCode()
  {
    return 31 * body.hashCode() + 1;
  }

  @Override
  public String toString()
  {
    return "(not " + body + ")";
  }
}
