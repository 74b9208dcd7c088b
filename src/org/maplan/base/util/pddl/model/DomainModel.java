package org.maplan.base.util.pddl.model;

import java.util.List;
import java.util.Set;

import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;

/**
 * An immutable, parsed planning domain.  Built by a {@link DomainBuilder}.
 */
public final class DomainModel
{
  private final String                                mName;
  private final ImmutableSet<String>                  mRequirements;
  private final TypeHierarchy                         mTypes;
  private final ImmutableSetMultimap<String, String>  mConstants;
  private final ImmutableList<PddlPredicateSignature> mPredicates;
  private final ImmutableList<PddlFunctionSignature>  mFunctions;
  private final ImmutableList<PddlAction>             mActions;

  DomainModel(String xiName,
              Set<String> xiRequirements,
              TypeHierarchy xiTypes,
              SetMultimap<String, String> xiConstants,
              List<PddlPredicateSignature> xiPredicates,
              List<PddlFunctionSignature> xiFunctions,
              List<PddlAction> xiActions)
  {
    mName = xiName;
    mRequirements = ImmutableSet.copyOf(xiRequirements);
    mTypes = xiTypes;
    mConstants = ImmutableSetMultimap.copyOf(xiConstants);
    mPredicates = ImmutableList.copyOf(xiPredicates);
    mFunctions = ImmutableList.copyOf(xiFunctions);
    mActions = ImmutableList.copyOf(xiActions);
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the retained requirement flags, without their leading ':'.
   */
  public Set<String> getRequirements()
  {
    return mRequirements;
  }

  public TypeHierarchy getTypes()
  {
    return mTypes;
  }

  /**
   * @return the constants, keyed by declared type.
   */
  public SetMultimap<String, String> getConstants()
  {
    return mConstants;
  }

  public List<PddlPredicateSignature> getPredicates()
  {
    return mPredicates;
  }

  public List<PddlFunctionSignature> getFunctions()
  {
    return mFunctions;
  }

  public List<PddlAction> getActions()
  {
    return mActions;
  }

  /**
   * @return the named action, or null if there isn't one.
   *
   * @param xiName - the action name.
   */
  public PddlAction getAction(String xiName)
  {
    for (PddlAction lAction : mActions)
    {
      if (lAction.getName().equals(xiName))
      {
        return lAction;
      }
    }
    return null;
  }

  /**
   * @return the types used for the agent parameter of any action.  Empty for a classical domain.
   */
  public Set<String> getAgentTypes()
  {
    ImmutableSet.Builder<String> lAgentTypes = ImmutableSet.builder();
    for (PddlAction lAction : mActions)
    {
      if (lAction.getAgentType() != null)
      {
        lAgentTypes.add(lAction.getAgentType());
      }
    }
    return lAgentTypes.build();
  }

  @Override
  public String toString()
  {
    return "DOMAIN: " + mName + "\n" +
           "REQUIREMENTS: " + mRequirements + "\n" +
           "TYPES: " + mTypes + "\n" +
           "PREDICATES: " + mPredicates + "\n" +
           "ACTIONS: " + mActions + "\n" +
           "FUNCTIONS: " + mFunctions + "\n" +
           "CONSTANTS: " + mConstants;
  }
}
