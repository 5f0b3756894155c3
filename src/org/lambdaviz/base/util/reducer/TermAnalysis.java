package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lambdaviz.base.util.term.TermUtils;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermVariable;

/**
 * Summary of the shape of a term, computed once for the final term of a reduction.
 */
public final class TermAnalysis
{
  /**
   * Broad classification of a term.
   */
  public static enum Kind
  {
    VARIABLE("variable"),
    CLOSED_LAMBDA("closed_lambda"),
    OPEN_LAMBDA("open_lambda"),
    APPLICATION("application");

    private final String mLabel;

    private Kind(String xiLabel)
    {
      mLabel = xiLabel;
    }

    @Override
    public String toString()
    {
      return mLabel;
    }
  }

  private final Kind         mKind;
  private final List<String> mFreeVariables;
  private final List<String> mBoundVariables;
  private final int          mLambdaCount;
  private final int          mComplexity;

  private TermAnalysis(Kind xiKind,
                       List<String> xiFreeVariables,
                       List<String> xiBoundVariables,
                       int xiLambdaCount,
                       int xiComplexity)
  {
    mKind = xiKind;
    mFreeVariables = Collections.unmodifiableList(xiFreeVariables);
    mBoundVariables = Collections.unmodifiableList(xiBoundVariables);
    mLambdaCount = xiLambdaCount;
    mComplexity = xiComplexity;
  }

  /**
   * @return an analysis of the specified term.
   */
  public static TermAnalysis of(Term xiTerm)
  {
    List<String> lFree = new ArrayList<>(TermUtils.getFreeVariables(xiTerm));
    List<String> lBound = new ArrayList<>(TermUtils.getBoundVariables(xiTerm));

    Kind lKind;
    if (xiTerm instanceof TermVariable)
    {
      lKind = Kind.VARIABLE;
    }
    else if (xiTerm instanceof TermLambda)
    {
      lKind = lFree.isEmpty() ? Kind.CLOSED_LAMBDA : Kind.OPEN_LAMBDA;
    }
    else
    {
      lKind = Kind.APPLICATION;
    }

    return new TermAnalysis(lKind, lFree, lBound, TermUtils.countLambdas(xiTerm), xiTerm.toString().length());
  }

  public Kind getKind()
  {
    return mKind;
  }

  public List<String> getFreeVariables()
  {
    return mFreeVariables;
  }

  public List<String> getBoundVariables()
  {
    return mBoundVariables;
  }

  public int getLambdaCount()
  {
    return mLambdaCount;
  }

  /**
   * @return whether the term has no free variables.
   */
  public boolean isClosed()
  {
    return mFreeVariables.isEmpty();
  }

  /**
   * @return the length of the canonical print of the term.
   */
  public int getComplexity()
  {
    return mComplexity;
  }

  @Override
  public String toString()
  {
    return mKind + " (free " + mFreeVariables + ", bound " + mBoundVariables + ", " + mLambdaCount + " lambdas, " +
           "complexity " + mComplexity + ")";
  }
}
