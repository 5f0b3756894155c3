package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lambdaviz.base.util.term.grammar.Term;

/**
 * Record of one reduction run.  This is everything a downstream consumer (renderer, job runner) needs; it never has
 * to look inside a {@link Term}.
 */
public final class ReductionResult
{
  private final String           mOriginalTerm;
  private final Term             mFinal;
  private final boolean          mNormalForm;
  private final int              mStepsTaken;
  private final boolean          mMaxStepsReached;
  private final boolean          mStagnationDetected;
  private final Strategy         mStrategy;
  private final String           mCombinator;
  private final List<TraceEntry> mTrace;
  private final TermAnalysis     mAnalysis;

  ReductionResult(String xiOriginalTerm,
                  Term xiFinal,
                  boolean xiNormalForm,
                  int xiStepsTaken,
                  boolean xiMaxStepsReached,
                  boolean xiStagnationDetected,
                  Strategy xiStrategy,
                  String xiCombinator,
                  List<TraceEntry> xiTrace)
  {
    mOriginalTerm = xiOriginalTerm;
    mFinal = xiFinal;
    mNormalForm = xiNormalForm;
    mStepsTaken = xiStepsTaken;
    mMaxStepsReached = xiMaxStepsReached;
    mStagnationDetected = xiStagnationDetected;
    mStrategy = xiStrategy;
    mCombinator = xiCombinator;
    mTrace = Collections.unmodifiableList(new ArrayList<>(xiTrace));
    mAnalysis = TermAnalysis.of(xiFinal);
  }

  /**
   * @return the canonical print of the input term.
   */
  public String getOriginalTerm()
  {
    return mOriginalTerm;
  }

  /**
   * @return the canonical print of the term after the last step.
   */
  public String getFinalTerm()
  {
    return mFinal.toString();
  }

  /**
   * @return the term after the last step.
   */
  public Term getFinal()
  {
    return mFinal;
  }

  /**
   * @return true iff no redex remained under the chosen strategy.
   */
  public boolean isNormalForm()
  {
    return mNormalForm;
  }

  /**
   * @return the number of beta steps actually performed.
   */
  public int getStepsTaken()
  {
    return mStepsTaken;
  }

  /**
   * @return true iff the run was cut short - by the step bound or by the stagnation guard - rather than ending in a
   *         normal form.
   */
  public boolean isMaxStepsReached()
  {
    return mMaxStepsReached;
  }

  /**
   * @return whether the run was stopped early because the trailing snapshots were identical (likely divergence).
   */
  public boolean isStagnationDetected()
  {
    return mStagnationDetected;
  }

  public Strategy getStrategy()
  {
    return mStrategy;
  }

  /**
   * @return the name of the known combinator the final term matches, or null if none (or classification is off).
   */
  public String getCombinator()
  {
    return mCombinator;
  }

  /**
   * @return the full history, starting with step 0 (the input).
   */
  public List<TraceEntry> getTrace()
  {
    return mTrace;
  }

  public TermAnalysis getAnalysis()
  {
    return mAnalysis;
  }

  @Override
  public String toString()
  {
    return mOriginalTerm + " => " + getFinalTerm() + " (" + mStrategy + ", " + mStepsTaken + " steps" +
           (mNormalForm ? ", normal form" : "") +
           (mMaxStepsReached ? ", bounded" : "") +
           (mStagnationDetected ? ", stagnant" : "") +
           ((mCombinator != null) ? ", " + mCombinator : "") + ")";
  }
}
