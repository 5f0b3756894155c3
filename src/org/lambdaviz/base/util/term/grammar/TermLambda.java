package org.lambdaviz.base.util.term.grammar;

import org.lambdaviz.base.util.term.TermUtils;

/**
 * A <i>lambda</i> is an abstraction.  It owns its parameter, which scopes over the body except where a nested lambda
 * re-binds the same name.
 *
 * See {@link Term} for a complete description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class TermLambda extends Term
{

  private final TermVariable parameter;
  private final Term         body;
  private final int          hash;

  TermLambda(TermVariable parameter, Term body)
  {
    this.parameter = parameter;
    this.body = body;
    this.hash = 31 * parameter.hashCode() + body.hashCode();
  }

  public TermVariable getParameter()
  {
    return parameter;
  }

  public Term getBody()
  {
    return body;
  }

  @Override
  public boolean isClosed()
  {
    return TermUtils.getFreeVariables(this).isEmpty();
  }

  @Override
  public int hashCode()
  {
    return hash;
  }

}
