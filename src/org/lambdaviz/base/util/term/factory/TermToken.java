package org.lambdaviz.base.util.term.factory;

/**
 * A single lexical token of term text, with the character offset it started at.
 */
public final class TermToken
{
  /**
   * Token types.  Both textual forms of the abstraction marker map to {@link #LAMBDA}.
   */
  public static enum Type
  {
    LAMBDA,
    DOT,
    OPEN_PAREN,
    CLOSE_PAREN,
    IDENTIFIER
  }

  private final Type   mType;
  private final String mText;
  private final int    mOffset;

  public TermToken(Type xiType, String xiText, int xiOffset)
  {
    mType = xiType;
    mText = xiText;
    mOffset = xiOffset;
  }

  public Type getType()
  {
    return mType;
  }

  /**
   * @return the token text.  For {@link Type#LAMBDA} this is always the normalized marker <code>\</code>.
   */
  public String getText()
  {
    return mText;
  }

  public int getOffset()
  {
    return mOffset;
  }

  @Override
  public String toString()
  {
    return mType + "(" + mText + ")@" + mOffset;
  }
}
