package org.maplan.base.util.pddl.grammar;

import java.util.Map;
import java.util.Objects;

/**
 * A <i>numeric effect</i> changes the value of a function term by a constant, e.g.
 * <code>(increase (total-cost) 1)</code>.
 *
 * See {@link Pddl} for a complete description of the PDDL hierarchy.
 */
public final class PddlNumericEffect extends PddlLiteral
{
  /**
   * Supported numeric operations.
   */
  public static enum Operation
  {
    INCREASE("increase"),
    DECREASE("decrease"),
    ASSIGN("assign");

    private final String mKeyword;

    private Operation(String xiKeyword)
    {
      mKeyword = xiKeyword;
    }

    public String getKeyword()
    {
      return mKeyword;
    }

    /**
     * @return the operation with the specified keyword, or null if there isn't one.
     *
     * @param xiKeyword - the PDDL keyword.
     */
    public static Operation fromKeyword(String xiKeyword)
    {
      for (Operation lOperation : values())
      {
        if (lOperation.mKeyword.equals(xiKeyword))
        {
          return lOperation;
        }
      }
      return null;
    }

    /**
     * @return the result of applying this operation.
     *
     * @param xiCurrent - the current value.
     * @param xiValue - the operand.
     */
    public double apply(double xiCurrent, double xiValue)
    {
      switch (this)
      {
        case INCREASE: return xiCurrent + xiValue;
        case DECREASE: return xiCurrent - xiValue;
        default:       return xiValue;
      }
    }
  }

  private final Operation operation;
  private final PddlAtom  function;
  private final String    value;

  public PddlNumericEffect(Operation operation, PddlAtom function, String value)
  {
    this.operation = operation;
    this.function = function;
    this.value = value;
  }

  public Operation getOperation()
  {
    return operation;
  }

  /**
   * @return the function term, e.g. <code>(total-cost)</code>.
   */
  public PddlAtom getFunction()
  {
    return function;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public boolean isGround()
  {
    return function.isGround();
  }

  @Override
  public PddlNumericEffect substitute(Map<String, String> xiBinding)
  {
    return new PddlNumericEffect(operation, function.substitute(xiBinding), value);
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof PddlNumericEffect))
    {
      return false;
    }
    PddlNumericEffect lOther = (PddlNumericEffect)other;
    return (operation == lOther.operation) && function.equals(lOther.function) && value.equals(lOther.value);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(operation, function, value);
  }

  @Override
  public String toString()
  {
    return "(" + operation.getKeyword() + " " + function + " " + value + ")";
  }
}
