package org.maplan.base.util.pddl.model;

import java.util.ArrayList;
import java.util.List;

import org.maplan.base.util.pddl.factory.exceptions.UnknownTypeException;
import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlLiteral;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Mutable accumulator for a problem.  Owned by exactly one parse and discarded once {@link #build()} has been called.
 */
public final class ProblemBuilder
{
  private final String                        mName;
  private final String                        mDomainName;
  private final TypeHierarchy                 mTypes;
  private final SetMultimap<String, String>   mObjects         = LinkedHashMultimap.create();
  private final List<PddlAtom>                mInit            = new ArrayList<>();
  private final List<PddlGroundFunctionValue> mGroundFunctions = new ArrayList<>();
  private final List<PddlLiteral>             mGoal            = new ArrayList<>();
  private boolean                             mMetric          = false;

  /**
   * Create a builder.
   *
   * @param xiName - the problem name.
   * @param xiDomainName - the domain named by the problem.
   * @param xiTypes - the domain's types, against which object types are checked.
   */
  public ProblemBuilder(String xiName, String xiDomainName, TypeHierarchy xiTypes)
  {
    mName = xiName;
    mDomainName = xiDomainName;
    mTypes = xiTypes;
  }

  /**
   * Record an object.
   *
   * @param xiName - the object.
   * @param xiType - its type, which must be known to the domain.
   *
   * @throws UnknownTypeException if the type isn't known.
   */
  public ProblemBuilder addObject(String xiName, String xiType) throws UnknownTypeException
  {
    if (!mTypes.isKnown(xiType))
    {
      throw new UnknownTypeException(xiType, mTypes.getKnownTypes());
    }
    mObjects.put(xiType, xiName);
    return this;
  }

  public ProblemBuilder addInit(PddlAtom xiFact)
  {
    mInit.add(xiFact);
    return this;
  }

  public ProblemBuilder addGroundFunction(PddlGroundFunctionValue xiValue)
  {
    mGroundFunctions.add(xiValue);
    return this;
  }

  public ProblemBuilder addGoal(List<PddlLiteral> xiGoal)
  {
    mGoal.addAll(xiGoal);
    return this;
  }

  public ProblemBuilder setMetric()
  {
    mMetric = true;
    return this;
  }

  public ProblemModel build()
  {
    return new ProblemModel(mName, mDomainName, mObjects, mInit, mGroundFunctions, mGoal, mMetric);
  }
}
