package org.maplan.base.validator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.maplan.base.util.pddl.factory.DomainParser;
import org.maplan.base.util.pddl.factory.PddlDialect;
import org.maplan.base.util.pddl.factory.ProblemParser;
import org.maplan.base.util.pddl.factory.exceptions.PddlException;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;
import org.maplan.base.util.pddl.multiagent.MultiAgentPddlSource;
import org.maplan.base.util.pddl.writer.ClassicalPddlWriter;
import org.maplan.base.util.planning.ClassicalActionInstance;
import org.maplan.base.util.planning.ClassicalPddlReader;
import org.maplan.base.util.planning.ClassicalProblem;
import org.maplan.base.util.planning.PlanChecker;
import org.maplan.base.util.planning.ProblemKind;
import org.maplan.base.util.planning.SequentialPlanValidator;
import org.maplan.base.util.planning.ValidationResult;
import org.maplan.base.util.planning.plan.PartialOrderPlan;
import org.maplan.base.util.planning.plan.Plan;
import org.maplan.base.validator.ValidatorConfiguration.CfgItem;
import org.maplan.base.validator.exceptions.PlanConversionException;

/**
 * Validates multi-agent plans.
 *
 * The multi-agent problem is translated into a classical one in which each agent's version of each action is a
 * separate action.  Each step of the plan is then mapped onto its classical action and the resulting sequential plans
 * are checked by a {@link PlanChecker}.  Partial-order plans are checked one linearization at a time.
 *
 * Each call to {@link #validate} is independent.  Nothing is kept between calls.
 */
public final class MultiAgentPlanValidator
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name reported in results.
   */
  public static final String NAME = "MAPlanValidator";

  /**
   * Logging context key under which the problem name is recorded for the duration of a request.
   */
  public static final String PROBLEM_CONTEXT_KEY = "problem";

  private final PlanChecker            mChecker;
  private final ValidatorConfiguration mConfig;

  /**
   * Create a validator.
   *
   * @param xiChecker - the sequential plan checker.
   * @param xiConfig - the configuration.
   */
  public MultiAgentPlanValidator(PlanChecker xiChecker, ValidatorConfiguration xiConfig)
  {
    mChecker = xiChecker;
    mConfig = xiConfig;
  }

  /**
   * Create a validator using the built-in sequential plan checker and the standard configuration, which is logged.
   *
   * @throws IOException if the configuration can't be read.
   */
  public MultiAgentPlanValidator() throws IOException
  {
    this(new SequentialPlanValidator(), new ValidatorConfiguration());
    mConfig.logConfig();
  }

  /**
   * Validate a plan.
   *
   * @param xiSource - the multi-agent problem.
   * @param xiPlan - the plan.
   *
   * @return the verdict.
   *
   * @throws ValidatorException if no verdict can be reached, e.g. because the problem is malformed or the plan refers
   *                            to actions that don't exist.
   */
  public ValidationResult validate(MultiAgentPddlSource xiSource, Plan xiPlan) throws ValidatorException
  {
    ThreadContext.put(PROBLEM_CONTEXT_KEY, xiSource.getName());
    try
    {
      LOGGER.info("Validating " + xiPlan.getKind() + " of " + xiPlan.getActions().size() + " actions");

      LOGGER.debug("Stage " + ValidationStage.RECEIVED);
      ClassicalProblem lProblem = buildClassicalProblem(xiSource);

      LOGGER.debug("Stage " + ValidationStage.MODEL_BUILT);
      checkCapabilities(lProblem.getKind());
      List<ClassicalActionInstance> lNodes;
      try
      {
        lNodes = new PlanRemapper(lProblem).remap(xiPlan.getActions());
      }
      catch (PlanConversionException lEx)
      {
        throw new ValidatorException(ValidationStage.MODEL_BUILT, lEx.getMessage(), lEx);
      }

      LOGGER.debug("Stage " + ValidationStage.LINEARIZING);
      ValidationResult lResult;
      if (xiPlan.getKind() == Plan.PlanKind.SEQUENTIAL_PLAN)
      {
        ValidationResult lChecked = mChecker.validate(lProblem, lNodes);
        lResult = new ValidationResult(lChecked.getStatus(), NAME, lChecked.getLogMessages(), 1);
      }
      else
      {
        LinearizationSearch lSearch = new LinearizationSearch(mChecker,
                                                              lProblem,
                                                              mConfig.getPolicy(),
                                                              mConfig.getCfgInt(CfgItem.MAX_LINEARIZATIONS),
                                                              mConfig.getCfgInt(CfgItem.LINEARIZATION_THREADS),
                                                              NAME);
        lResult = lSearch.search(lNodes, ((PartialOrderPlan)xiPlan).linearizations());
      }

      LOGGER.debug("Stage " + ValidationStage.DONE);
      LOGGER.info("Plan is " + lResult.getStatus());
      return lResult;
    }
    finally
    {
      ThreadContext.remove(PROBLEM_CONTEXT_KEY);
    }
  }

  /**
   * Translate the multi-agent problem into a classical one, going via files in a scratch directory.
   */
  private ClassicalProblem buildClassicalProblem(MultiAgentPddlSource xiSource) throws ValidatorException
  {
    boolean lStrict = mConfig.getCfgBool(CfgItem.STRICT_DOMAIN_NAME);

    try (ScratchDirectory lScratch = new ScratchDirectory(mConfig.getCfgStr(CfgItem.SCRATCH_ROOT),
                                                          xiSource.getName()))
    {
      Path lMaDomainFile = lScratch.write("ma/domain.pddl", xiSource.writeDomain());
      Path lMaProblemFile = lScratch.write("ma/problem.pddl", xiSource.writeProblem());

      DomainModel lDomain = new DomainParser(PddlDialect.MULTI_AGENT).parse(lScratch.read(lMaDomainFile));
      ProblemModel lProblem = new ProblemParser(lStrict).parse(lScratch.read(lMaProblemFile), lDomain);

      ClassicalPddlWriter lWriter = new ClassicalPddlWriter();
      Path lDomainFile = lScratch.write("classical/domain.pddl", lWriter.writeDomain(lDomain));
      Path lProblemFile = lScratch.write("classical/problem.pddl",
                                         lWriter.writeProblem(new PlanningTask(lDomain, lProblem)));

      ClassicalProblem lClassical = new ClassicalPddlReader(lStrict).read(lDomainFile, lProblemFile);
      LOGGER.debug("Built classical problem with " + lClassical.getTask().getDomain().getActions().size() +
                   " actions and kind " + lClassical.getKind());
      return lClassical;
    }
    catch (PddlException lEx)
    {
      throw new ValidatorException(ValidationStage.RECEIVED, "Invalid problem: " + lEx.getMessage(), lEx);
    }
    catch (IOException lEx)
    {
      throw new ValidatorException(ValidationStage.RECEIVED, "Scratch file failure: " + lEx, lEx);
    }
  }

  /**
   * Check that the plan checker understands the problem.
   */
  private void checkCapabilities(ProblemKind xiKind) throws ValidatorException
  {
    if (mConfig.getCfgBool(CfgItem.SKIP_CHECKS) || mChecker.supports(xiKind))
    {
      return;
    }

    List<ProblemKind.Feature> lMissing = new ArrayList<>(xiKind.missingFrom(mChecker.supportedKind()));
    String lMessage = "Problem uses features " + lMissing + " that " + mChecker.getName() + " does not support";
    if (mConfig.getCfgBool(CfgItem.ERROR_ON_FAILED_CHECKS))
    {
      throw new ValidatorException(ValidationStage.MODEL_BUILT, lMessage);
    }
    LOGGER.warn(lMessage);
  }
}
