package org.lambdaviz.base.apps.reducer;

import org.lambdaviz.base.util.config.EngineConfiguration;
import org.lambdaviz.base.util.engine.TermEngine;
import org.lambdaviz.base.util.reducer.ReductionResult;
import org.lambdaviz.base.util.reducer.Strategy;
import org.lambdaviz.base.util.reducer.TraceEntry;
import org.lambdaviz.base.util.term.factory.exceptions.TermFormatException;

/**
 * This is a simple command line app for reducing a lambda term and printing its trace.
 */
public final class ReducerRunner
{
  private static final int NUM_FIXED_ARGS = 1;

  public static void main(String[] args)
  {
    if (args.length < NUM_FIXED_ARGS)
    {
      System.out.println("ReducerRunner <expression> [strategy] [max-steps]");
      System.out.println("example: ReducerRunner \"(\\x.\\y.x) a b\" normal-order 50");
      return;
    }

    EngineConfiguration.logConfig();

    String lExpression = args[0];
    Strategy lStrategy;
    int lMaxSteps;
    try
    {
      lStrategy = (args.length > 1) ? Strategy.fromName(args[1]) : TermEngine.getDefaultStrategy();
      lMaxSteps = (args.length > 2) ? Integer.parseInt(args[2]) : TermEngine.getDefaultMaxSteps();
    }
    catch (IllegalArgumentException lEx)
    {
      System.out.println(lEx.getMessage());
      System.exit(2);
      return;
    }

    TermEngine lEngine = new TermEngine();
    ReductionResult lResult;
    try
    {
      lResult = lEngine.evaluate(lExpression, lStrategy, lMaxSteps);
    }
    catch (TermFormatException lEx)
    {
      System.out.println(lExpression);
      System.out.println(pointerTo(lEx.getPosition()));
      System.out.println(lEx.getMessage());
      System.exit(1);
      return;
    }

    for (TraceEntry lEntry : lResult.getTrace())
    {
      System.out.println(lEntry + ((lEntry.getRedex() != null) ? "    -- " + lEntry.getRedex() : ""));
    }

    System.out.println("Strategy:    " + lResult.getStrategy());
    System.out.println("Final term:  " + lResult.getFinalTerm());
    System.out.println("Steps:       " + lResult.getStepsTaken());
    System.out.println("Normal form: " + lResult.isNormalForm());
    if (lResult.isMaxStepsReached())
    {
      System.out.println(lResult.isStagnationDetected() ? "Stopped: term is not changing (likely divergent)" :
                                                          "Stopped: step bound reached (possibly divergent)");
    }
    if (lResult.getCombinator() != null)
    {
      System.out.println("Combinator:  " + lResult.getCombinator());
    }
    System.out.println("Analysis:    " + lResult.getAnalysis());
  }

  private static String pointerTo(int xiPosition)
  {
    StringBuilder sb = new StringBuilder();
    for (int lii = 0; lii < xiPosition; lii++)
    {
      sb.append(' ');
    }
    return sb.append('^').toString();
  }
}
