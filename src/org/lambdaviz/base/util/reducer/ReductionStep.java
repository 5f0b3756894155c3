package org.lambdaviz.base.util.reducer;

import org.lambdaviz.base.util.term.grammar.Term;

/**
 * Outcome of a single beta step: the whole new term and a description of the redex that was contracted.
 */
public final class ReductionStep
{
  private final Term             mTerm;
  private final RedexDescription mDescription;

  public ReductionStep(Term xiTerm, RedexDescription xiDescription)
  {
    mTerm = xiTerm;
    mDescription = xiDescription;
  }

  public Term getTerm()
  {
    return mTerm;
  }

  public RedexDescription getDescription()
  {
    return mDescription;
  }
}
