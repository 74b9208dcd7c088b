package org.maplan.base.util.pddl.multiagent;

/**
 * Source of the MA-PDDL text for a multi-agent problem.  The validator asks for fresh text on every request.
 */
public interface MultiAgentPddlSource
{
  /**
   * @return the problem name, used for logging and for naming scratch files.
   */
  public String getName();

  /**
   * @return the MA-PDDL domain text.
   */
  public String writeDomain();

  /**
   * @return the MA-PDDL problem text.
   */
  public String writeProblem();
}
