package org.lambdaviz.base.util.reducer;

import java.util.Arrays;
import java.util.Locale;

/**
 * Reduction strategies.  Each one is a redex search order; the contraction itself is always the same beta step.
 */
public enum Strategy
{
  /**
   * Leftmost-outermost, reducing under lambdas.  Finds a normal form whenever one exists.
   */
  NORMAL_ORDER(new NormalOrderRedexFinder()),

  /**
   * Leftmost-innermost, reducing under lambdas.
   */
  APPLICATIVE_ORDER(new ApplicativeOrderRedexFinder()),

  /**
   * Leftmost-outermost along the function spine only, never under lambdas (weak head normal form).
   */
  CALL_BY_NAME(new CallByNameRedexFinder()),

  /**
   * Function, then argument, to values before contracting, never under lambdas.
   */
  CALL_BY_VALUE(new CallByValueRedexFinder());

  private final RedexFinder mRedexFinder;

  private Strategy(RedexFinder xiRedexFinder)
  {
    mRedexFinder = xiRedexFinder;
  }

  /**
   * @return the redex search order for this strategy.
   */
  public RedexFinder getRedexFinder()
  {
    return mRedexFinder;
  }

  /**
   * @return the strategy with the specified name.  Case is ignored and '-' may be used in place of '_', so
   *         "normal-order" and "NORMAL_ORDER" are equivalent.
   *
   * @param xiName - the strategy name.
   *
   * @throws IllegalArgumentException if there is no such strategy.
   */
  public static Strategy fromName(String xiName)
  {
    if (xiName == null)
    {
      throw unknown(xiName, null);
    }

    String lNormalized = xiName.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try
    {
      return valueOf(lNormalized);
    }
    catch (IllegalArgumentException lEx)
    {
      throw unknown(xiName, lEx);
    }
  }

  private static IllegalArgumentException unknown(String xiName, Throwable xiCause)
  {
    return new IllegalArgumentException("Unknown strategy '" + xiName + "'.  Available choices are: " +
                                        Arrays.toString(values()), xiCause);
  }
}
