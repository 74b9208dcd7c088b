package org.maplan.base.util.pddl.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.maplan.base.util.pddl.factory.exceptions.UnknownTypeException;
import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Mutable accumulator for a domain.  Owned by exactly one parse and discarded once {@link #build()} has been called.
 */
public final class DomainBuilder
{
  private final String                       mName;
  private final Set<String>                  mRequirements = new LinkedHashSet<>();
  private final TypeHierarchy.Builder        mTypes        = new TypeHierarchy.Builder();
  private final SetMultimap<String, String>  mConstants    = LinkedHashMultimap.create();
  private final List<PddlPredicateSignature> mPredicates   = new ArrayList<>();
  private final List<PddlFunctionSignature>  mFunctions    = new ArrayList<>();
  private final List<PddlAction>             mActions      = new ArrayList<>();

  public DomainBuilder(String xiName)
  {
    mName = xiName;
  }

  public TypeHierarchy.Builder types()
  {
    return mTypes;
  }

  /**
   * Check that a type has already been declared.
   *
   * @param xiType - the type.
   *
   * @throws UnknownTypeException if it hasn't.
   */
  public void checkType(String xiType) throws UnknownTypeException
  {
    if (!mTypes.isKnown(xiType))
    {
      throw new UnknownTypeException(xiType, mTypes.getKnownTypes());
    }
  }

  public DomainBuilder addRequirement(String xiRequirement)
  {
    mRequirements.add(xiRequirement);
    return this;
  }

  /**
   * Record a constant.
   *
   * @param xiName - the constant.
   * @param xiType - its type, which must already be known.
   *
   * @throws UnknownTypeException if the type isn't known.
   */
  public DomainBuilder addConstant(String xiName, String xiType) throws UnknownTypeException
  {
    checkType(xiType);
    mConstants.put(xiType, xiName);
    return this;
  }

  public DomainBuilder addPredicate(PddlPredicateSignature xiPredicate)
  {
    mPredicates.add(xiPredicate);
    return this;
  }

  /**
   * @return the predicate declared so far with the specified name, or null if there isn't one.
   *
   * @param xiName - the predicate name.
   */
  public PddlPredicateSignature getPredicate(String xiName)
  {
    for (PddlPredicateSignature lPredicate : mPredicates)
    {
      if (lPredicate.getName().equals(xiName))
      {
        return lPredicate;
      }
    }
    return null;
  }

  public DomainBuilder addFunction(PddlFunctionSignature xiFunction)
  {
    mFunctions.add(xiFunction);
    return this;
  }

  public DomainBuilder addAction(PddlAction xiAction)
  {
    mActions.add(xiAction);
    return this;
  }

  public DomainModel build()
  {
    return new DomainModel(mName,
                           mRequirements,
                           mTypes.build(),
                           mConstants,
                           mPredicates,
                           mFunctions,
                           mActions);
  }
}
