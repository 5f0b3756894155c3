package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;

/**
 * A sub-term reached during a redex search, linked back to its parent so that the path from the root is only built
 * for the node that is actually returned.
 */
final class SearchNode
{
  final Term               mTerm;
  private final PathStep   mStep;
  private final SearchNode mParent;

  private SearchNode(Term xiTerm, PathStep xiStep, SearchNode xiParent)
  {
    mTerm = xiTerm;
    mStep = xiStep;
    mParent = xiParent;
  }

  static SearchNode root(Term xiTerm)
  {
    return new SearchNode(xiTerm, null, null);
  }

  SearchNode function()
  {
    return new SearchNode(((TermApplication)mTerm).getFunction(), PathStep.FUNCTION, this);
  }

  SearchNode argument()
  {
    return new SearchNode(((TermApplication)mTerm).getArgument(), PathStep.ARGUMENT, this);
  }

  SearchNode body()
  {
    return new SearchNode(((TermLambda)mTerm).getBody(), PathStep.BODY, this);
  }

  /**
   * @return a redex for this node, whose term must be a redex application.
   */
  Redex toRedex()
  {
    List<PathStep> lPath = new ArrayList<>();
    for (SearchNode lNode = this; lNode.mStep != null; lNode = lNode.mParent)
    {
      lPath.add(lNode.mStep);
    }
    Collections.reverse(lPath);
    return new Redex(lPath, (TermApplication)mTerm);
  }
}
