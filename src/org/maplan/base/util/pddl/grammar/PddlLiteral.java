package org.maplan.base.util.pddl.grammar;

import java.util.Map;

/**
 * A <i>literal</i> is a condition or an effect of an action, or a goal condition.  This can be an <i>atom</i>, a
 * <i>not</i> or a <i>numeric effect</i>.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public abstract class PddlLiteral extends Pddl
{
  /**
   * @return whether this literal is variable-free.
   */
  public abstract boolean isGround();

  /**
   * @return a copy of this literal with every argument found in the binding replaced by the bound value.  Arguments
   *         that aren't bound are copied unchanged.
   *
   * @param xiBinding - map from argument name to replacement.
   */
  public abstract PddlLiteral substitute(Map<String, String> xiBinding);
}
