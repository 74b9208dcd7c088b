package org.maplan.base.validator;

/**
 * The stages a validation request passes through.
 */
public enum ValidationStage
{
  /**
   * The request has been accepted but the classical problem hasn't been built.
   */
  RECEIVED,

  /**
   * The classical problem exists.  Capability checks and plan remapping happen here.
   */
  MODEL_BUILT,

  /**
   * Sequential plans are being checked.
   */
  LINEARIZING,

  /**
   * A verdict has been reached.
   */
  DONE;
}
