package org.lambdaviz.base.test;

import java.util.LinkedList;

import org.lambdaviz.base.util.reducer.BetaReducer;
import org.lambdaviz.base.util.reducer.ReductionResult;
import org.lambdaviz.base.util.reducer.Strategy;
import org.lambdaviz.base.util.term.TermUtils;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.lambdaviz.base.util.term.grammar.Term;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Reduce a set of well-known terms and check their normal forms (up to renaming).
 */
@RunWith(Parameterized.class)
public class KnownTermTest extends Assert
{
  private static final String TRUE  = "(\\t.\\f.t)";
  private static final String FALSE = "(\\t.\\f.f)";
  private static final String AND   = "(\\p.\\q.p q p)";
  private static final String SUCC  = "(\\n.\\f.\\x.f (n f x))";
  private static final String MULT  = "(\\m.\\n.\\f.m (n f))";
  private static final String TWO   = "(\\f.\\x.f (f x))";
  private static final String THREE = "(\\f.\\x.f (f (f x)))";

  /**
   * @return the tests to run: name, term, expected normal form, expected classification.
   */
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();

    lTests.add(new Object[] {"S K K", "(\\x.\\y.\\z.x z (y z)) (\\x.\\y.x) (\\x.\\y.x)", "\\z.z", "I (Identity)"});
    lTests.add(new Object[] {"and true false", AND + " " + TRUE + " " + FALSE, "\\t.\\f.f", "KI (False / Church 0)"});
    lTests.add(new Object[] {"and true true", AND + " " + TRUE + " " + TRUE, "\\t.\\f.t", "K (Constant)"});
    lTests.add(new Object[] {"succ 2", SUCC + " " + TWO, "\\f.\\x.f (f (f x))", "Church 3"});
    lTests.add(new Object[] {"2 * 3", MULT + " " + TWO + " " + THREE, "\\f.\\x.f (f (f (f (f (f x)))))", "Church 6"});
    lTests.add(new Object[] {"B I I", "(\\f.\\g.\\x.f (g x)) (\\x.x) (\\x.x)", "\\x.x", "I (Identity)"});
    lTests.add(new Object[] {"open result", "(\\x.\\y.x y) w", "\\y.w y", null});

    return lTests;
  }

  private final String mName;
  private final String mTerm;
  private final String mExpected;
  private final String mCombinator;

  public KnownTermTest(String xiName, String xiTerm, String xiExpected, String xiCombinator)
  {
    mName = xiName;
    mTerm = xiTerm;
    mExpected = xiExpected;
    mCombinator = xiCombinator;
  }

  @Test
  public void testReducesToExpectedForm() throws Exception
  {
    TermFactory lFactory = new TermFactory(true);
    Term lTerm = lFactory.parse(mTerm);

    ReductionResult lResult = new BetaReducer(3, true).reduce(lTerm, Strategy.NORMAL_ORDER, 200);

    assertTrue(mName, lResult.isNormalForm());
    assertTrue(mName + " gave " + lResult.getFinalTerm(),
               TermUtils.alphaEquivalent(lFactory.parse(mExpected), lResult.getFinal()));
    assertEquals(mName, mCombinator, lResult.getCombinator());
  }
}
