package org.lambdaviz.base.test;

import org.lambdaviz.base.util.reducer.BetaReducer;
import org.lambdaviz.base.util.reducer.ReductionResult;
import org.lambdaviz.base.util.reducer.Strategy;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.junit.Assert;
import org.junit.Test;

/**
 * Checks that the four strategies pick different redexes where they should.
 */
public class StrategyTests extends Assert
{
  private static final String DISCARDED_OMEGA = "(\\x.\\y.y) ((\\x.x x) (\\x.x x))";

  private final BetaReducer mReducer = new BetaReducer(3, false);

  private ReductionResult reduce(String xiText, Strategy xiStrategy) throws Exception
  {
    return mReducer.reduce(new TermFactory(true).parse(xiText), xiStrategy, 20);
  }

  @Test
  public void testLazyStrategiesDiscardDivergentArgument() throws Exception
  {
    for (Strategy lStrategy : new Strategy[] {Strategy.NORMAL_ORDER, Strategy.CALL_BY_NAME})
    {
      ReductionResult lResult = reduce(DISCARDED_OMEGA, lStrategy);
      assertEquals(lStrategy.toString(), "\\y.y", lResult.getFinalTerm());
      assertEquals(1, lResult.getStepsTaken());
      assertTrue(lResult.isNormalForm());
    }
  }

  @Test
  public void testEagerStrategiesDiverge() throws Exception
  {
    for (Strategy lStrategy : new Strategy[] {Strategy.APPLICATIVE_ORDER, Strategy.CALL_BY_VALUE})
    {
      ReductionResult lResult = reduce(DISCARDED_OMEGA, lStrategy);
      assertFalse(lStrategy.toString(), lResult.isNormalForm());
      assertTrue(lResult.isStagnationDetected());
      assertTrue(lResult.isMaxStepsReached());
      assertEquals(DISCARDED_OMEGA, lResult.getFinalTerm());
    }
  }

  @Test
  public void testArgumentOrder() throws Exception
  {
    ReductionResult lNormal = reduce("(\\x.x) ((\\y.y) z)", Strategy.NORMAL_ORDER);
    ReductionResult lApplicative = reduce("(\\x.x) ((\\y.y) z)", Strategy.APPLICATIVE_ORDER);

    assertEquals("(\\y.y) z", lNormal.getTrace().get(1).getTerm());
    assertEquals("(\\x.x) z", lApplicative.getTrace().get(1).getTerm());
    assertEquals("z", lNormal.getFinalTerm());
    assertEquals("z", lApplicative.getFinalTerm());
  }

  @Test
  public void testWeakStrategiesStopAtLambdas() throws Exception
  {
    String lText = "\\x.(\\y.y) x";

    assertEquals("\\x.x", reduce(lText, Strategy.NORMAL_ORDER).getFinalTerm());
    assertEquals("\\x.x", reduce(lText, Strategy.APPLICATIVE_ORDER).getFinalTerm());

    for (Strategy lStrategy : new Strategy[] {Strategy.CALL_BY_NAME, Strategy.CALL_BY_VALUE})
    {
      ReductionResult lResult = reduce(lText, lStrategy);
      assertEquals(0, lResult.getStepsTaken());
      assertTrue(lResult.isNormalForm());
      assertEquals(lText, lResult.getFinalTerm());
    }
  }

  @Test
  public void testCallByValueStuckFunction() throws Exception
  {
    String lText = "x y ((\\y.y) z)";

    ReductionResult lValue = reduce(lText, Strategy.CALL_BY_VALUE);
    assertEquals(0, lValue.getStepsTaken());
    assertEquals(lText, lValue.getFinalTerm());

    assertEquals("x y z", reduce(lText, Strategy.NORMAL_ORDER).getFinalTerm());
  }

  @Test
  public void testCallByNameLeavesArguments() throws Exception
  {
    ReductionResult lResult = reduce("x ((\\y.y) z)", Strategy.CALL_BY_NAME);
    assertEquals(0, lResult.getStepsTaken());
    assertEquals("x ((\\y.y) z)", lResult.getFinalTerm());
  }

  @Test
  public void testFromName()
  {
    assertEquals(Strategy.NORMAL_ORDER, Strategy.fromName("normal-order"));
    assertEquals(Strategy.CALL_BY_VALUE, Strategy.fromName("Call_By_Value"));
    assertEquals(Strategy.APPLICATIVE_ORDER, Strategy.fromName(" applicative-order "));
    assertEquals(Strategy.CALL_BY_NAME, Strategy.fromName("CALL_BY_NAME"));
  }

  @Test
  public void testFromUnknownName()
  {
    try
    {
      Strategy.fromName("lazy");
      fail();
    }
    catch (IllegalArgumentException lEx)
    {
      assertTrue(lEx.getMessage().contains("NORMAL_ORDER"));
    }
  }

  @Test
  public void testFromNullName()
  {
    try
    {
      Strategy.fromName(null);
      fail();
    }
    catch (IllegalArgumentException lEx)
    {
      assertTrue(lEx.getMessage().contains("CALL_BY_VALUE"));
    }
  }
}
