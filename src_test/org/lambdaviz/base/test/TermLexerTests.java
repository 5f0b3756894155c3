package org.lambdaviz.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;

import org.lambdaviz.base.util.term.factory.TermLexer;
import org.lambdaviz.base.util.term.factory.TermToken;
import org.lambdaviz.base.util.term.factory.TermToken.Type;
import org.lambdaviz.base.util.term.factory.exceptions.LexException;
import org.junit.Test;

public class TermLexerTests
{
  @Test
  public void testBothLambdaMarkers() throws Exception
  {
    TermLexer lLexer = new TermLexer(false);

    List<TermToken> lAscii = lLexer.tokenize("\\x.x");
    List<TermToken> lGlyph = lLexer.tokenize("λx.x");

    assertEquals(4, lAscii.size());
    assertEquals(4, lGlyph.size());
    for (int lii = 0; lii < lAscii.size(); lii++)
    {
      assertEquals(lAscii.get(lii).getType(), lGlyph.get(lii).getType());
    }
    assertEquals(Type.LAMBDA, lGlyph.get(0).getType());
    assertEquals(Type.IDENTIFIER, lGlyph.get(1).getType());
    assertEquals(Type.DOT, lGlyph.get(2).getType());
  }

  @Test
  public void testIdentifiersAndOffsets() throws Exception
  {
    List<TermToken> lTokens = new TermLexer(false).tokenize("foo1  (bar)");

    assertEquals(4, lTokens.size());
    assertEquals("foo1", lTokens.get(0).getText());
    assertEquals(0, lTokens.get(0).getOffset());
    assertEquals(Type.OPEN_PAREN, lTokens.get(1).getType());
    assertEquals(6, lTokens.get(1).getOffset());
    assertEquals("bar", lTokens.get(2).getText());
    assertEquals(7, lTokens.get(2).getOffset());
    assertEquals(Type.CLOSE_PAREN, lTokens.get(3).getType());
  }

  @Test
  public void testLenientSkipsUnknownCharacters() throws Exception
  {
    List<TermToken> lTokens = new TermLexer(false).tokenize("\\x.x$");
    assertEquals(4, lTokens.size());
    assertEquals(Type.IDENTIFIER, lTokens.get(3).getType());
  }

  @Test
  public void testStrictRejectsUnknownCharacters()
  {
    try
    {
      new TermLexer(true).tokenize("\\x.x$");
      fail("Expected a lexing failure");
    }
    catch (LexException lEx)
    {
      assertEquals(4, lEx.getPosition());
    }
  }

  @Test
  public void testEmptyInput()
  {
    for (String lText : new String[] {"", "   ", "\t\n"})
    {
      try
      {
        new TermLexer(false).tokenize(lText);
        fail("Expected a lexing failure for '" + lText + "'");
      }
      catch (LexException lEx)
      {
        assertEquals(0, lEx.getPosition());
      }
    }
  }

  @Test(expected=LexException.class)
  public void testNothingButJunk() throws Exception
  {
    new TermLexer(false).tokenize("$%&");
  }
}
