package org.lambdaviz.base.test;

import java.util.ArrayList;
import java.util.Arrays;

import org.lambdaviz.base.util.term.TermUtils;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermPool;
import org.junit.Assert;
import org.junit.Test;

public class TermUtilsTests extends Assert
{
  private static Term parse(String xiText) throws Exception
  {
    return new TermFactory(true).parse(xiText);
  }

  @Test
  public void testVariableSets() throws Exception
  {
    Term lTerm = parse("\\x.x y (\\y.y z) x");

    assertEquals(Arrays.asList("y", "z"), new ArrayList<>(TermUtils.getFreeVariables(lTerm)));
    assertEquals(Arrays.asList("x", "y"), new ArrayList<>(TermUtils.getBoundVariables(lTerm)));
    assertTrue(TermUtils.isFreeIn("z", lTerm));
    assertFalse(TermUtils.isFreeIn("x", lTerm));
    assertFalse(lTerm.isClosed());
    assertTrue(parse("\\x.\\y.x y").isClosed());
  }

  @Test
  public void testShapeMetrics() throws Exception
  {
    Term lTerm = parse("(\\x.x) (y z)");

    assertEquals(1, TermUtils.countLambdas(lTerm));
    assertEquals(6, TermUtils.size(lTerm));
    assertEquals(3, TermUtils.depth(lTerm));
    assertEquals(1, TermUtils.depth(parse("x")));
  }

  @Test
  public void testAlphaEquivalence() throws Exception
  {
    assertTrue(TermUtils.alphaEquivalent(parse("\\x.\\y.x"), parse("\\a.\\b.a")));
    assertFalse(TermUtils.alphaEquivalent(parse("\\x.\\y.x"), parse("\\a.\\b.b")));
    assertFalse(TermUtils.alphaEquivalent(parse("\\x.y"), parse("\\x.z")));
  }

  @Test
  public void testNameValidation()
  {
    assertTrue(TermPool.isValidName("x0"));
    assertFalse(TermPool.isValidName("0x"));
    assertFalse(TermPool.isValidName("λ"));
    assertFalse(TermPool.isValidName(""));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBadVariableName()
  {
    TermPool.getVariable("a-b");
  }

  @Test
  public void testDeepTerms()
  {
    // f (f (... (f x)...)) with 20000 applications, built twice.
    Term lLeft = TermPool.getVariable("x");
    Term lRight = TermPool.getVariable("x");
    for (int lii = 0; lii < 20000; lii++)
    {
      lLeft = TermPool.getApplication(TermPool.getVariable("f"), lLeft);
      lRight = TermPool.getApplication(TermPool.getVariable("f"), lRight);
    }

    assertEquals(Arrays.asList("f", "x"), new ArrayList<>(TermUtils.getFreeVariables(lLeft)));
    assertTrue(TermUtils.getBoundVariables(lLeft).isEmpty());
    assertEquals(20001, TermUtils.depth(lLeft));
    assertEquals(40001, TermUtils.size(lLeft));
    assertEquals(lLeft, lRight);
    assertEquals(lLeft.hashCode(), lRight.hashCode());
    assertTrue(TermUtils.alphaEquivalent(lLeft, lRight));
    assertTrue(lLeft.toString().startsWith("f (f (f ("));
    assertTrue(lLeft.toString().endsWith("(f x)))"));
  }
}
