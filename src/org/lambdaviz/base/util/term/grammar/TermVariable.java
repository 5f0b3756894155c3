package org.lambdaviz.base.util.term.grammar;

/**
 * A <i>variable</i> is a reference to a binder, written as an identifier.
 *
 * See {@link Term} for a complete description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class TermVariable extends Term
{

  private final String name;

  TermVariable(String name)
  {
    this.name = name.intern();
  }

  public String getName()
  {
    return name;
  }

  @Override
  public boolean isClosed()
  {
    return false;
  }

  @Override
  public int hashCode()
  {
    return name.hashCode();
  }

  @Override
  void appendTo(StringBuilder xoBuffer)
  {
    xoBuffer.append(name);
  }

  @Override
  public String toString()
  {
    return name;
  }

}
