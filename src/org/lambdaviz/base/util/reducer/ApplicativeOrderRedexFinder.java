package org.lambdaviz.base.util.reducer;

import java.util.ArrayDeque;
import java.util.Deque;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;

/**
 * Leftmost-innermost redex selection.  The function side and then the argument side of an application are searched
 * before the application itself is tested, so the deepest leftmost redex is contracted first.  Reduces under lambdas.
 */
public class ApplicativeOrderRedexFinder implements RedexFinder
{
  @Override
  public Redex findRedex(Term xiTerm)
  {
    // Depth-first, post-order.  An application is pushed back (marked as expanded) beneath its children and only
    // tested once both of them have been searched.
    Deque<SearchNode> lWork = new ArrayDeque<>();
    Deque<Boolean> lExpanded = new ArrayDeque<>();
    lWork.push(SearchNode.root(xiTerm));
    lExpanded.push(false);

    while (!lWork.isEmpty())
    {
      SearchNode lNode = lWork.pop();
      boolean lDone = lExpanded.pop();

      if (lNode.mTerm instanceof TermApplication)
      {
        if (lDone)
        {
          if (((TermApplication)lNode.mTerm).isRedex())
          {
            return lNode.toRedex();
          }
        }
        else
        {
          lWork.push(lNode);
          lExpanded.push(true);
          lWork.push(lNode.argument());
          lExpanded.push(false);
          lWork.push(lNode.function());
          lExpanded.push(false);
        }
      }
      else if (lNode.mTerm instanceof TermLambda)
      {
        lWork.push(lNode.body());
        lExpanded.push(false);
      }
    }

    return null;
  }
}
