package org.lambdaviz.base.util.term.factory.exceptions;

/**
 * Thrown when a token sequence does not form exactly one term.
 */
public class TermParseException extends TermFormatException
{
  private static final long serialVersionUID = 1L;

  /**
   * Text used for {@link #getFound()} when the tokens ran out.
   */
  public static final String END_OF_INPUT = "end of input";

  private final String mExpected;
  private final String mFound;

  /**
   * @param xiPosition - character offset of the offending token (or the input length at end of input).
   * @param xiExpected - what the grammar required at this point.
   * @param xiFound    - the token actually found, or {@link #END_OF_INPUT}.
   */
  public TermParseException(int xiPosition, String xiExpected, String xiFound)
  {
    super("Expected " + xiExpected + " but found " + describe(xiFound) + " at offset " + xiPosition, xiPosition);
    mExpected = xiExpected;
    mFound = xiFound;
  }

  private static String describe(String xiFound)
  {
    return END_OF_INPUT.equals(xiFound) ? xiFound : "'" + xiFound + "'";
  }

  public String getExpected()
  {
    return mExpected;
  }

  public String getFound()
  {
    return mFound;
  }
}
