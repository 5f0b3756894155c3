package org.lambdaviz.base.util.term.factory.exceptions;

/**
 * Thrown when term text cannot be tokenized: it is empty after whitespace normalization, yields no tokens, or (in
 * strict mode) contains a character that is not part of the term syntax.
 */
public class LexException extends TermFormatException
{
  private static final long serialVersionUID = 1L;

  public LexException(String xiMessage, int xiPosition)
  {
    super(xiMessage + " at offset " + xiPosition, xiPosition);
  }
}
