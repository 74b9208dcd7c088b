package org.maplan.base.util.pddl.multiagent;

/**
 * MA-PDDL source for a domain and problem that are already available as text.
 */
public final class TextualMultiAgentSource implements MultiAgentPddlSource
{
  private final String mName;
  private final String mDomain;
  private final String mProblem;

  /**
   * @param xiName - the problem name.
   * @param xiDomain - the MA-PDDL domain text.
   * @param xiProblem - the MA-PDDL problem text.
   */
  public TextualMultiAgentSource(String xiName, String xiDomain, String xiProblem)
  {
    mName = xiName;
    mDomain = xiDomain;
    mProblem = xiProblem;
  }

  @Override
  public String getName()
  {
    return mName;
  }

  @Override
  public String writeDomain()
  {
    return mDomain;
  }

  @Override
  public String writeProblem()
  {
    return mProblem;
  }
}
