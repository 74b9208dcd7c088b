package org.maplan.base.util.planning;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;
import org.maplan.base.util.pddl.model.PddlAction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A classical action applied to specific objects.
 */
public final class ClassicalActionInstance
{
  private final PddlAction            mAction;
  private final ImmutableList<String> mParameters;

  /**
   * @param xiAction - the action.
   * @param xiParameters - one object per action parameter, in order.
   */
  public ClassicalActionInstance(PddlAction xiAction, List<String> xiParameters)
  {
    Preconditions.checkArgument(xiAction.getParameters().size() == xiParameters.size(),
                                "%s takes %s parameters, not %s",
                                xiAction.getName(),
                                xiAction.getParameters().size(),
                                xiParameters.size());
    mAction = xiAction;
    mParameters = ImmutableList.copyOf(xiParameters);
  }

  public PddlAction getAction()
  {
    return mAction;
  }

  public List<String> getParameters()
  {
    return mParameters;
  }

  /**
   * @return the mapping from the action's parameter variables to the objects they're bound to.
   */
  public Map<String, String> getBinding()
  {
    ImmutableMap.Builder<String, String> lBinding = ImmutableMap.builder();
    for (int lii = 0; lii < mParameters.size(); lii++)
    {
      lBinding.put(mAction.getParameters().get(lii).getName(), mParameters.get(lii));
    }
    return lBinding.build();
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof ClassicalActionInstance))
    {
      return false;
    }
    ClassicalActionInstance lOther = (ClassicalActionInstance)other;
    return mAction.getName().equals(lOther.mAction.getName()) && mParameters.equals(lOther.mParameters);
  }

  @Override
  public int hashCode()
  {
    return mAction.getName().hashCode() * 31 + mParameters.hashCode();
  }

  @Override
  public String toString()
  {
    if (mParameters.isEmpty())
    {
      return "(" + mAction.getName() + ")";
    }
    return "(" + mAction.getName() + " " + StringUtils.join(mParameters, ' ') + ")";
  }
}
