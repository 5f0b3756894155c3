package org.lambdaviz.base.util.term.factory;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.term.factory.TermToken.Type;
import org.lambdaviz.base.util.term.factory.exceptions.LexException;
import org.lambdaviz.base.util.term.grammar.TermPool;

/**
 * Converts term text into a flat token sequence.  The lexer has no knowledge of the grammar.
 *
 * Whitespace is discarded.  The abstraction marker may be written as a backslash or as the Unicode lambda glyph; both
 * produce a {@link Type#LAMBDA} token.  Identifiers are maximal runs of name characters starting with a letter.
 *
 * Any other character is skipped with a warning in lenient mode, or rejected in strict mode.
 */
public final class TermLexer
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The ASCII abstraction marker.
   */
  public static final char LAMBDA_MARKER = '\\';

  private final boolean mStrict;

  /**
   * Create a lexer.
   *
   * @param xiStrict - whether unrecognised characters are an error (true) or silently dropped (false).
   */
  public TermLexer(boolean xiStrict)
  {
    mStrict = xiStrict;
  }

  /**
   * @return the tokens of the specified text, in order.
   *
   * @param xiText - the term text.
   *
   * @throws LexException if the text is empty after whitespace normalization, produces no tokens, or (in strict mode)
   *                      contains an unrecognised character.
   */
  public List<TermToken> tokenize(String xiText) throws LexException
  {
    if ((xiText == null) || xiText.trim().isEmpty())
    {
      throw new LexException("Empty expression", 0);
    }

    List<TermToken> lTokens = new ArrayList<>();
    int lii = 0;

    while (lii < xiText.length())
    {
      char lChar = xiText.charAt(lii);

      if (Character.isWhitespace(lChar))
      {
        lii++;
      }
      else if ((lChar == LAMBDA_MARKER) || (lChar == TermPool.LAMBDA_GLYPH))
      {
        lTokens.add(new TermToken(Type.LAMBDA, String.valueOf(LAMBDA_MARKER), lii));
        lii++;
      }
      else if (lChar == '.')
      {
        lTokens.add(new TermToken(Type.DOT, ".", lii));
        lii++;
      }
      else if (lChar == '(')
      {
        lTokens.add(new TermToken(Type.OPEN_PAREN, "(", lii));
        lii++;
      }
      else if (lChar == ')')
      {
        lTokens.add(new TermToken(Type.CLOSE_PAREN, ")", lii));
        lii++;
      }
      else if (TermPool.isNameStart(lChar))
      {
        int lStart = lii;
        while ((lii < xiText.length()) && TermPool.isNameCharacter(xiText.charAt(lii)))
        {
          lii++;
        }
        lTokens.add(new TermToken(Type.IDENTIFIER, xiText.substring(lStart, lii), lStart));
      }
      else
      {
        if (mStrict)
        {
          throw new LexException("Unrecognised character '" + lChar + "'", lii);
        }
        LOGGER.warn("Ignoring unrecognised character '" + lChar + "' at offset " + lii + " in: " + xiText);
        lii++;
      }
    }

    if (lTokens.isEmpty())
    {
      throw new LexException("No tokens in expression", 0);
    }

    LOGGER.trace("Tokens: " + lTokens);
    return lTokens;
  }
}
