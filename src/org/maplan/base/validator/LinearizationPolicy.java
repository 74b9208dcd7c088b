package org.maplan.base.validator;

/**
 * What a partial-order plan's linearizations must satisfy for the plan to be valid.
 */
public enum LinearizationPolicy
{
  /**
   * At least one linearization is a valid sequential plan.  The search stops at the first that is.
   */
  ANY,

  /**
   * Every linearization is a valid sequential plan.  The search stops at the first that isn't.
   */
  ALL;
}
