package org.maplan.base.util.pddl.grammar;

/**
 * Class at the root of the PDDL hierarchy.  All parts of a parsed domain or problem are represented by objects that
 * are part of this hierarchy, and every one of them can render itself back into PDDL text via {@link #toString()}.
 *
 * <h1>The PDDL hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Typed parameter</b>: A name (usually a variable starting with ?) and the type it is declared with, written
 *     <code>?r - robot</code>.
 *
 * <li><b>Parameter list</b>: An ordered list of <i>typed parameters</i>, as found after <code>:parameters</code>.
 *     For a multi-agent action the agent parameter is always the first entry.
 *
 * <li><b>Predicate signature</b>: A name followed by <i>typed parameters</i>, as declared in
 *     <code>:predicates</code>.  Its arity is fixed once parsed.
 *
 * <li><b>Literal</b>: A condition or effect.<ul>
 *
 *   <li><b>Atom</b>: A name followed by untyped arguments.  The arguments may be variables (in an action) or objects
 *       (in a ground fact or goal).
 *
 *   <li><b>Not</b>: A negated <i>atom</i>.
 *
 *   <li><b>Numeric effect</b>: <code>(increase (total-cost) 1)</code> and friends.  Only a constant value applied to
 *       a function term is supported.</ul>
 *
 * <li><b>Function signature</b>: A numeric function declaration, as found in <code>:functions</code>.
 *
 * <li><b>Ground function value</b>: An initial assignment <code>(= (total-cost) 0)</code>.
 *
 * </ul>
 *
 * <h1>Worked example</h1>
 *
 * <p><pre>{@code
 * (:action move
 *   :agent ?r - robot
 *   :parameters (?from ?to - location)
 *   :precondition (at ?r ?from)
 *   :effect (and (not (at ?r ?from)) (at ?r ?to)))}</pre>
 *
 * <ul>
 *   <li><code>?r - robot</code> is a <i>typed parameter</i>.  It becomes parameter 0 of the action.
 *   <li><code>?from - location</code> and <code>?to - location</code> are <i>typed parameters</i> 1 and 2.
 *   <li><code>(at ?r ?from)</code> is an <i>atom</i> of arity 2.
 *   <li><code>(not (at ?r ?from))</code> is a <i>not</i>.
 * </ul>
 */
public abstract class Pddl
{
  @Override
  public abstract String toString();
}
