package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;

/**
 * A redex located inside a term: the application itself and the path to it from the root.
 */
public final class Redex
{
  private final List<PathStep>  mPath;
  private final TermApplication mApplication;

  /**
   * @param xiPath        - path from the root of the containing term (empty for the root itself).  Copied.
   * @param xiApplication - the redex, whose function must be a lambda.
   */
  public Redex(List<PathStep> xiPath, TermApplication xiApplication)
  {
    assert(xiApplication.isRedex());
    mPath = Collections.unmodifiableList(new ArrayList<>(xiPath));
    mApplication = xiApplication;
  }

  public List<PathStep> getPath()
  {
    return mPath;
  }

  public TermApplication getApplication()
  {
    return mApplication;
  }

  /**
   * @return the lambda in function position.
   */
  public TermLambda getLambda()
  {
    return (TermLambda)mApplication.getFunction();
  }

  @Override
  public String toString()
  {
    return mApplication + " at " + (mPath.isEmpty() ? "<root>" : mPath.toString());
  }
}
