package org.lambdaviz.base.util.reducer;

import java.util.LinkedList;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;

/**
 * Call-by-name redex selection (weak head reduction).  Like normal order, but never looks inside a lambda and never
 * reduces an argument: only the spine of function positions is searched.  Arguments are passed unevaluated.
 */
public class CallByNameRedexFinder implements RedexFinder
{
  @Override
  public Redex findRedex(Term xiTerm)
  {
    LinkedList<PathStep> lPath = new LinkedList<>();
    Term lCurrent = xiTerm;

    while (lCurrent instanceof TermApplication)
    {
      TermApplication lApp = (TermApplication)lCurrent;
      if (lApp.isRedex())
      {
        return new Redex(lPath, lApp);
      }
      lPath.addLast(PathStep.FUNCTION);
      lCurrent = lApp.getFunction();
    }

    return null;
  }
}
