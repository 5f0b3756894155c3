package org.lambdaviz.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.lambdaviz.base.util.reducer.classifier.Combinator;
import org.lambdaviz.base.util.reducer.classifier.CombinatorClassifier;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.lambdaviz.base.util.term.grammar.Term;
import org.junit.Test;

public class CombinatorClassifierTests
{
  private static Term parse(String xiText) throws Exception
  {
    return new TermFactory(true).parse(xiText);
  }

  @Test
  public void testAlphaInsensitive() throws Exception
  {
    assertEquals(Combinator.I, CombinatorClassifier.classify(parse("\\a.a")));
    assertEquals(Combinator.K, CombinatorClassifier.classify(parse("\\p.\\q.p")));
    assertEquals(Combinator.S, CombinatorClassifier.classify(parse("\\a.\\b.\\c.a c (b c)")));
    assertEquals(Combinator.Y, CombinatorClassifier.classify(parse("\\g.(\\h.g (h h)) (\\k.g (k k))")));
  }

  @Test
  public void testEveryBuiltInClassifiesAsItself() throws Exception
  {
    for (Combinator lCombinator : Combinator.values())
    {
      assertEquals(lCombinator, CombinatorClassifier.classify(parse(lCombinator.getExpression())));
    }
  }

  @Test
  public void testChurchNumerals() throws Exception
  {
    assertEquals(0, CombinatorClassifier.churchNumeralValue(parse("\\f.\\x.x")));
    assertEquals(2, CombinatorClassifier.churchNumeralValue(parse("\\s.\\z.s (s z)")));
    assertEquals(-1, CombinatorClassifier.churchNumeralValue(parse("\\f.\\x.x f")));
    assertEquals("KI (False / Church 0)", CombinatorClassifier.describe(parse("\\f.\\x.x")));
    assertEquals("Church 6", CombinatorClassifier.describe(parse("\\s.\\z.s (s (s (s (s (s z)))))")));
  }

  @Test
  public void testUnknownTerms() throws Exception
  {
    assertNull(CombinatorClassifier.classify(parse("\\x.y")));
    assertNull(CombinatorClassifier.describe(parse("\\x.y")));
    assertNull(CombinatorClassifier.describe(parse("\\x.\\y.y x")));
    assertNull(CombinatorClassifier.describe(parse("x")));
  }

  @Test
  public void testLargeChurchNumeral() throws Exception
  {
    StringBuilder lText = new StringBuilder("\\f.\\x.");
    for (int lii = 0; lii < 999; lii++)
    {
      lText.append("f (");
    }
    lText.append("f x");
    for (int lii = 0; lii < 999; lii++)
    {
      lText.append(')');
    }

    assertEquals(1000, CombinatorClassifier.churchNumeralValue(parse(lText.toString())));
    assertEquals("Church 1000", CombinatorClassifier.describe(parse(lText.toString())));
    assertEquals(-1, CombinatorClassifier.churchNumeralValue(parse("\\f.\\x.f (f (f f))")));
    assertEquals(-1, CombinatorClassifier.churchNumeralValue(parse("\\f.\\x.f (f x) x")));
  }
}
