package org.lambdaviz.base.util.reducer;

import org.lambdaviz.base.util.term.grammar.Term;

/**
 * Interface for redex selection.  Each reduction strategy is a search order over the term tree.
 */
public interface RedexFinder
{
  /**
   * @param term - the term to search.
   * @return the redex this strategy would contract next, or null if there is none reachable under this strategy
   *         (the term is in normal form for this strategy).
   */
  public Redex findRedex(Term term);
}
