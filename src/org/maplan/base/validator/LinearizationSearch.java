package org.maplan.base.validator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.maplan.base.util.planning.ClassicalActionInstance;
import org.maplan.base.util.planning.ClassicalProblem;
import org.maplan.base.util.planning.LogMessage;
import org.maplan.base.util.planning.PlanChecker;
import org.maplan.base.util.planning.ValidationResult;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Checks the linearizations of a partial-order plan until a verdict is reached.
 *
 * Linearizations are pulled lazily, so the search never does more work than the verdict requires.  With more than
 * one thread, up to that many linearizations are checked at once and everything outstanding is cancelled as soon as
 * one result decides the verdict.
 */
public final class LinearizationSearch
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final PlanChecker         mChecker;
  private final ClassicalProblem    mProblem;
  private final LinearizationPolicy mPolicy;
  private final int                 mMaxLinearizations;
  private final int                 mThreads;
  private final String              mEngineName;

  /**
   * Create a search.
   *
   * @param xiChecker - the sequential plan checker.
   * @param xiProblem - the classical problem.
   * @param xiPolicy - which linearizations must be valid.
   * @param xiMaxLinearizations - the most linearizations to check, or negative for no limit.
   * @param xiThreads - the number of threads to check with.  1 (or less) checks in the calling thread.
   * @param xiEngineName - the name to report in the result.
   */
  public LinearizationSearch(PlanChecker xiChecker,
                             ClassicalProblem xiProblem,
                             LinearizationPolicy xiPolicy,
                             int xiMaxLinearizations,
                             int xiThreads,
                             String xiEngineName)
  {
    mChecker = xiChecker;
    mProblem = xiProblem;
    mPolicy = xiPolicy;
    mMaxLinearizations = xiMaxLinearizations;
    mThreads = Math.max(1, xiThreads);
    mEngineName = xiEngineName;
  }

  /**
   * Search for a verdict.
   *
   * @param xiNodes - the remapped plan nodes.
   * @param xiOrders - the linearizations, as orders over the node indices.
   *
   * @return the verdict.
   *
   * @throws ValidatorException if the search is interrupted or the checker fails.
   */
  public ValidationResult search(List<ClassicalActionInstance> xiNodes, Iterable<List<Integer>> xiOrders)
      throws ValidatorException
  {
    LOGGER.debug("Searching linearizations with policy " + mPolicy + " on " + mThreads + " thread(s)");
    if (mThreads == 1)
    {
      return searchInline(xiNodes, xiOrders.iterator());
    }
    return searchInPool(xiNodes, xiOrders.iterator());
  }

  private ValidationResult searchInline(List<ClassicalActionInstance> xiNodes, Iterator<List<Integer>> xiOrders)
  {
    int lChecked = 0;
    ValidationResult lLast = null;

    while (xiOrders.hasNext())
    {
      if (limitReached(lChecked))
      {
        return undecided(lChecked);
      }

      lLast = mChecker.validate(mProblem, toPlan(xiNodes, xiOrders.next()));
      lChecked++;
      if (isDecisive(lLast))
      {
        return decided(lLast, lChecked);
      }
    }

    return exhausted(lLast, lChecked);
  }

  private ValidationResult searchInPool(List<ClassicalActionInstance> xiNodes, Iterator<List<Integer>> xiOrders)
      throws ValidatorException
  {
    ExecutorService lPool = Executors.newFixedThreadPool(mThreads,
                                                         new ThreadFactoryBuilder().setNameFormat("linearize-%d")
                                                                                   .setDaemon(true)
                                                                                   .build());
    CompletionService<ValidationResult> lService = new ExecutorCompletionService<>(lPool);
    List<Future<ValidationResult>> lOutstanding = new ArrayList<>();
    Map<String, String> lContext = ThreadContext.getImmutableContext();

    int lSubmitted = 0;
    int lChecked = 0;
    ValidationResult lLast = null;

    try
    {
      while (true)
      {
        while ((lOutstanding.size() < mThreads) && xiOrders.hasNext() && !limitReached(lSubmitted))
        {
          lOutstanding.add(lService.submit(new CheckTask(toPlan(xiNodes, xiOrders.next()), lContext)));
          lSubmitted++;
        }

        if (lOutstanding.isEmpty())
        {
          break;
        }

        Future<ValidationResult> lDone = lService.take();
        lOutstanding.remove(lDone);
        lLast = lDone.get();
        lChecked++;
        if (isDecisive(lLast))
        {
          return decided(lLast, lChecked);
        }
      }
    }
    catch (InterruptedException lEx)
    {
      Thread.currentThread().interrupt();
      throw new ValidatorException(ValidationStage.LINEARIZING, "Interrupted after " + lChecked + " linearizations",
                                   lEx);
    }
    catch (ExecutionException lEx)
    {
      throw new ValidatorException(ValidationStage.LINEARIZING, "Plan checker failed: " + lEx.getCause(),
                                   lEx.getCause());
    }
    finally
    {
      for (Future<ValidationResult> lFuture : lOutstanding)
      {
        lFuture.cancel(true);
      }
      lPool.shutdownNow();
    }

    if (xiOrders.hasNext())
    {
      return undecided(lChecked);
    }
    return exhausted(lLast, lChecked);
  }

  /**
   * Checks one linearization on a pool thread, carrying the caller's logging context across.
   */
  private final class CheckTask implements Callable<ValidationResult>
  {
    private final List<ClassicalActionInstance> mPlan;
    private final Map<String, String>           mContext;

    CheckTask(List<ClassicalActionInstance> xiPlan, Map<String, String> xiContext)
    {
      mPlan = xiPlan;
      mContext = xiContext;
    }

    @Override
    public ValidationResult call()
    {
      ThreadContext.putAll(mContext);
      try
      {
        return mChecker.validate(mProblem, mPlan);
      }
      finally
      {
        ThreadContext.clearMap();
      }
    }
  }

  private static List<ClassicalActionInstance> toPlan(List<ClassicalActionInstance> xiNodes, List<Integer> xiOrder)
  {
    List<ClassicalActionInstance> lPlan = new ArrayList<>(xiOrder.size());
    for (int lNode : xiOrder)
    {
      lPlan.add(xiNodes.get(lNode));
    }
    return lPlan;
  }

  private boolean limitReached(int xiCount)
  {
    return (mMaxLinearizations >= 0) && (xiCount >= mMaxLinearizations);
  }

  /**
   * @return whether a single result settles the verdict under the policy.
   */
  private boolean isDecisive(ValidationResult xiResult)
  {
    return (mPolicy == LinearizationPolicy.ANY) == xiResult.isValid();
  }

  private ValidationResult decided(ValidationResult xiResult, int xiChecked)
  {
    LOGGER.debug("Verdict " + xiResult.getStatus() + " after " + xiChecked + " linearization(s)");
    return new ValidationResult(xiResult.getStatus(), mEngineName, xiResult.getLogMessages(), xiChecked);
  }

  /**
   * @return the verdict once every linearization has been checked without a decisive result.
   */
  private ValidationResult exhausted(ValidationResult xiLast, int xiChecked)
  {
    List<LogMessage> lMessages = new ArrayList<>();
    if (mPolicy == LinearizationPolicy.ANY)
    {
      lMessages.add(new LogMessage(Level.INFO, "None of the " + xiChecked + " linearizations is a valid plan"));
      if (xiLast != null)
      {
        lMessages.addAll(xiLast.getLogMessages());
      }
      LOGGER.debug(lMessages.get(0).getMessage());
      return new ValidationResult(ValidationResult.Status.INVALID, mEngineName, lMessages, xiChecked);
    }

    lMessages.add(new LogMessage(Level.INFO, "All " + xiChecked + " linearizations are valid plans"));
    LOGGER.debug(lMessages.get(0).getMessage());
    return new ValidationResult(ValidationResult.Status.VALID, mEngineName, lMessages, xiChecked);
  }

  private ValidationResult undecided(int xiChecked)
  {
    String lReason = "Stopped after " + xiChecked + " linearizations (MAX_LINEARIZATIONS) without a verdict";
    LOGGER.warn(lReason);
    List<LogMessage> lMessages = new ArrayList<>();
    lMessages.add(new LogMessage(Level.WARN, lReason));
    return new ValidationResult(ValidationResult.Status.INVALID, mEngineName, lMessages, xiChecked);
  }
}
