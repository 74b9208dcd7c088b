package org.maplan.base.util.pddl.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * The type hierarchy of a domain: a mapping from each supertype to its direct subordinate types.
 *
 * The root type "object" is always known, even if nothing has been declared under it.
 */
public final class TypeHierarchy
{
  public static final String ROOT_TYPE = "object";

  private final ImmutableSetMultimap<String, String> mSubtypes;
  private final ImmutableSet<String>                 mKnownTypes;

  private TypeHierarchy(SetMultimap<String, String> xiSubtypes, Set<String> xiKnownTypes)
  {
    mSubtypes = ImmutableSetMultimap.copyOf(xiSubtypes);
    mKnownTypes = ImmutableSet.copyOf(xiKnownTypes);
  }

  /**
   * @return whether the type has been declared (or is the root type).
   *
   * @param xiType - the type.
   */
  public boolean isKnown(String xiType)
  {
    return mKnownTypes.contains(xiType);
  }

  public Set<String> getKnownTypes()
  {
    return mKnownTypes;
  }

  /**
   * @return the types with at least one direct subordinate, in declaration order.
   */
  public Set<String> getSupertypes()
  {
    return mSubtypes.keySet();
  }

  /**
   * @return the direct subordinates of a type.
   *
   * @param xiType - the type.
   */
  public Set<String> getSubtypes(String xiType)
  {
    return mSubtypes.get(xiType);
  }

  /**
   * @return the type itself and everything that transitively descends from it.
   *
   * @param xiType - the type.
   */
  public Set<String> getDescendants(String xiType)
  {
    Set<String> lSelected = new LinkedHashSet<>();
    Deque<String> lPending = new ArrayDeque<>();
    lPending.add(xiType);

    while (!lPending.isEmpty())
    {
      String lType = lPending.poll();
      if (lSelected.add(lType))
      {
        lPending.addAll(mSubtypes.get(lType));
      }
    }

    return lSelected;
  }

  /**
   * @return whether the type is the ancestor, or descends from it.
   *
   * @param xiType - the candidate descendant.
   * @param xiAncestor - the candidate ancestor.
   */
  public boolean isSubtypeOf(String xiType, String xiAncestor)
  {
    return getDescendants(xiAncestor).contains(xiType);
  }

  /**
   * @return whether any type is declared below another user type, rather than directly under the root.
   */
  public boolean isHierarchical()
  {
    for (String lSupertype : mSubtypes.keySet())
    {
      if (!lSupertype.equals(ROOT_TYPE))
      {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof TypeHierarchy))
    {
      return false;
    }
    TypeHierarchy lOther = (TypeHierarchy)other;
    return mSubtypes.equals(lOther.mSubtypes) && mKnownTypes.equals(lOther.mKnownTypes);
  }

  @Override
  public int hashCode()
  {
    return mSubtypes.hashCode();
  }

  @Override
  public String toString()
  {
    return mSubtypes.toString();
  }

  /**
   * Accumulates type declarations during a single parse.
   */
  public static final class Builder
  {
    private final SetMultimap<String, String> mSubtypes = LinkedHashMultimap.create();
    private final Set<String>                 mKnownTypes = new LinkedHashSet<>();

    public Builder()
    {
      mKnownTypes.add(ROOT_TYPE);
    }

    /**
     * Declare a type as subordinate to a supertype.  A supertype that hasn't been seen before is itself placed
     * directly under the root.
     *
     * @param xiSubtype - the new type.
     * @param xiSupertype - its parent.
     */
    public Builder declare(String xiSubtype, String xiSupertype)
    {
      if (!mKnownTypes.contains(xiSupertype))
      {
        declareTopLevel(xiSupertype);
      }
      if (!xiSubtype.equals(xiSupertype))
      {
        mSubtypes.put(xiSupertype, xiSubtype);
      }
      mKnownTypes.add(xiSubtype);
      return this;
    }

    /**
     * Declare a type directly under the root.
     *
     * @param xiType - the new type.
     */
    public Builder declareTopLevel(String xiType)
    {
      if (!xiType.equals(ROOT_TYPE))
      {
        mSubtypes.put(ROOT_TYPE, xiType);
      }
      mKnownTypes.add(xiType);
      return this;
    }

    public boolean isKnown(String xiType)
    {
      return mKnownTypes.contains(xiType);
    }

    public Set<String> getKnownTypes()
    {
      return mKnownTypes;
    }

    public TypeHierarchy build()
    {
      return new TypeHierarchy(mSubtypes, mKnownTypes);
    }
  }
}
