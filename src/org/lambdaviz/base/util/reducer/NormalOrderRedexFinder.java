package org.lambdaviz.base.util.reducer;

import java.util.ArrayDeque;
import java.util.Deque;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;

/**
 * Leftmost-outermost redex selection.  An application is tested before anything inside it, then the function side is
 * searched before the argument side.  Reduces under lambdas.
 */
public class NormalOrderRedexFinder implements RedexFinder
{
  @Override
  public Redex findRedex(Term xiTerm)
  {
    // Depth-first, pre-order.  The function side is pushed last so that it is searched first.
    Deque<SearchNode> lWork = new ArrayDeque<>();
    lWork.push(SearchNode.root(xiTerm));

    while (!lWork.isEmpty())
    {
      SearchNode lNode = lWork.pop();

      if (lNode.mTerm instanceof TermApplication)
      {
        if (((TermApplication)lNode.mTerm).isRedex())
        {
          return lNode.toRedex();
        }
        lWork.push(lNode.argument());
        lWork.push(lNode.function());
      }
      else if (lNode.mTerm instanceof TermLambda)
      {
        lWork.push(lNode.body());
      }
    }

    return null;
  }
}
