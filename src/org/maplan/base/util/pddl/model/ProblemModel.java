package org.maplan.base.util.pddl.model;

import java.util.List;

import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlLiteral;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;

/**
 * An immutable, parsed planning problem.  Built by a {@link ProblemBuilder}.
 */
public final class ProblemModel
{
  private final String                                 mName;
  private final String                                 mDomainName;
  private final ImmutableSetMultimap<String, String>   mObjects;
  private final ImmutableList<PddlAtom>                mInit;
  private final ImmutableList<PddlGroundFunctionValue> mGroundFunctions;
  private final ImmutableList<PddlLiteral>             mGoal;
  private final boolean                                mMetric;

  ProblemModel(String xiName,
               String xiDomainName,
               SetMultimap<String, String> xiObjects,
               List<PddlAtom> xiInit,
               List<PddlGroundFunctionValue> xiGroundFunctions,
               List<PddlLiteral> xiGoal,
               boolean xiMetric)
  {
    mName = xiName;
    mDomainName = xiDomainName;
    mObjects = ImmutableSetMultimap.copyOf(xiObjects);
    mInit = ImmutableList.copyOf(xiInit);
    mGroundFunctions = ImmutableList.copyOf(xiGroundFunctions);
    mGoal = ImmutableList.copyOf(xiGoal);
    mMetric = xiMetric;
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the domain name given in the problem's (:domain ...) declaration.
   */
  public String getDomainName()
  {
    return mDomainName;
  }

  /**
   * @return the objects, keyed by declared type.
   */
  public SetMultimap<String, String> getObjects()
  {
    return mObjects;
  }

  public List<PddlAtom> getInit()
  {
    return mInit;
  }

  public List<PddlGroundFunctionValue> getGroundFunctions()
  {
    return mGroundFunctions;
  }

  public List<PddlLiteral> getGoal()
  {
    return mGoal;
  }

  /**
   * @return whether the problem has a (total-cost minimisation) metric.
   */
  public boolean hasMetric()
  {
    return mMetric;
  }

  @Override
  public String toString()
  {
    return "PROBLEM: " + mName + "\n" +
           "OBJECTS: " + mObjects + "\n" +
           "INIT: " + mInit + " " + mGroundFunctions + "\n" +
           "GOAL: " + mGoal;
  }
}
