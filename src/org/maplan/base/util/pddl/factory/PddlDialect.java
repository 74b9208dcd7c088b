package org.maplan.base.util.pddl.factory;

/**
 * The PDDL dialects understood by the parsers.
 */
public enum PddlDialect
{
  /**
   * MA-PDDL, in which every action declares its executing agent with <code>:agent</code>.
   */
  MULTI_AGENT,

  /**
   * Classical (single-agent) PDDL.
   */
  CLASSICAL;
}
