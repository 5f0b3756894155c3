package org.lambdaviz.base.util.reducer;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermVariable;

/**
 * Call-by-value redex selection.  Never looks inside a lambda.  In an application the function is reduced to a value
 * first, then the argument, and only then is the application itself contracted.  Values are lambdas and variables.
 *
 * An application whose function is stuck (not a value, but with no redex of its own) is stuck as a whole.
 */
public class CallByValueRedexFinder implements RedexFinder
{
  @Override
  public Redex findRedex(Term xiTerm)
  {
    SearchNode lNode = SearchNode.root(xiTerm);

    while (lNode.mTerm instanceof TermApplication)
    {
      TermApplication lApp = (TermApplication)lNode.mTerm;

      if (!isValue(lApp.getFunction()))
      {
        lNode = lNode.function();
      }
      else if (!isValue(lApp.getArgument()))
      {
        lNode = lNode.argument();
      }
      else
      {
        return lApp.isRedex() ? lNode.toRedex() : null;
      }
    }

    return null;
  }

  /**
   * @return whether the term is a value: a lambda or a variable.
   */
  static boolean isValue(Term xiTerm)
  {
    return (xiTerm instanceof TermLambda) || (xiTerm instanceof TermVariable);
  }
}
