package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One snapshot in a reduction trace.  Step 0 is the input term and has no redex description.
 */
public final class TraceEntry
{
  private final int              mStepIndex;
  private final String           mTerm;
  private final RedexDescription mRedex;
  private final List<String>     mFreeVariables;
  private final List<String>     mBoundVariables;

  public TraceEntry(int xiStepIndex,
                    String xiTerm,
                    RedexDescription xiRedex,
                    Set<String> xiFreeVariables,
                    Set<String> xiBoundVariables)
  {
    mStepIndex = xiStepIndex;
    mTerm = xiTerm;
    mRedex = xiRedex;
    mFreeVariables = Collections.unmodifiableList(new ArrayList<>(xiFreeVariables));
    mBoundVariables = Collections.unmodifiableList(new ArrayList<>(xiBoundVariables));
  }

  public int getStepIndex()
  {
    return mStepIndex;
  }

  /**
   * @return the canonical print of the term after this step.
   */
  public String getTerm()
  {
    return mTerm;
  }

  /**
   * @return the redex contracted to reach this snapshot, or null for the initial snapshot.
   */
  public RedexDescription getRedex()
  {
    return mRedex;
  }

  public List<String> getFreeVariables()
  {
    return mFreeVariables;
  }

  public List<String> getBoundVariables()
  {
    return mBoundVariables;
  }

  @Override
  public String toString()
  {
    return mStepIndex + ": " + mTerm;
  }
}
