package org.lambdaviz.base.util.term.factory.exceptions;

/**
 * Abstract class for exceptions that are a result of badly formed term text.
 */
public abstract class TermFormatException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final int mPosition;

  protected TermFormatException(String xiMessage, int xiPosition)
  {
    super(xiMessage);
    mPosition = xiPosition;
  }

  /**
   * @return the character offset in the input at which the problem was detected.
   */
  public int getPosition()
  {
    return mPosition;
  }
}
