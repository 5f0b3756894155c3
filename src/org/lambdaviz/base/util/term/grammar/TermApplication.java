package org.lambdaviz.base.util.term.grammar;

import org.lambdaviz.base.util.term.TermUtils;

/**
 * An <i>application</i> is the juxtaposition of a function term and an argument term.  When the function is a
 * {@link TermLambda} the application is a <i>redex</i>.
 *
 * See {@link Term} for a complete description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class TermApplication extends Term
{

  private final Term function;
  private final Term argument;
  private final int  hash;

  TermApplication(Term function, Term argument)
  {
    this.function = function;
    this.argument = argument;
    this.hash = 17 * function.hashCode() + argument.hashCode();
  }

  public Term getFunction()
  {
    return function;
  }

  public Term getArgument()
  {
    return argument;
  }

  /**
   * @return whether this application is a redex - i.e. its function is a lambda.
   */
  public boolean isRedex()
  {
    return function instanceof TermLambda;
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
