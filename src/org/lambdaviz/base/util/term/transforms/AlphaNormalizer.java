package org.lambdaviz.base.util.term.transforms;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermVariable;

/**
 * Produces a canonical printed form of a term in which every bound variable is replaced by the number of its binder
 * (binders are numbered in the order they are met, left to right).  Free variables keep their names.
 *
 * Two terms have the same canonical form if and only if they are alpha-equivalent.  Bound names are written
 * <code>#n</code>, which cannot clash with a free identifier.  The canonical form is for comparison only and does not
 * re-parse.
 */
public final class AlphaNormalizer
{
  private final Map<String, Deque<Integer>> mScopes = new HashMap<>();
  private final StringBuilder               mOutput = new StringBuilder();
  private int                               mNextBinder = 0;

  private AlphaNormalizer()
  {
  }

  /**
   * @return the canonical form of the term.
   *
   * @param xiTerm - the term.
   */
  public static String canonicalForm(Term xiTerm)
  {
    AlphaNormalizer lNormalizer = new AlphaNormalizer();
    lNormalizer.append(xiTerm);
    return lNormalizer.mOutput.toString();
  }

  private void append(Term xiTerm)
  {
    // Entries are terms still to print, literal text, or a parameter name whose scope ends at that point.
    Deque<Object> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Object lNext = lWork.pop();

      if (lNext instanceof String)
      {
        mOutput.append((String)lNext);
      }
      else if (lNext instanceof ScopeExit)
      {
        mScopes.get(((ScopeExit)lNext).mName).pop();
      }
      else if (lNext instanceof TermVariable)
      {
        String lName = ((TermVariable)lNext).getName();
        Deque<Integer> lScope = mScopes.get(lName);
        if ((lScope == null) || lScope.isEmpty())
        {
          mOutput.append(lName);
        }
        else
        {
          mOutput.append('#').append(lScope.peek());
        }
      }
      else if (lNext instanceof TermLambda)
      {
        TermLambda lLambda = (TermLambda)lNext;
        String lParam = lLambda.getParameter().getName();
        int lBinder = mNextBinder++;

        Deque<Integer> lScope = mScopes.get(lParam);
        if (lScope == null)
        {
          lScope = new ArrayDeque<>();
          mScopes.put(lParam, lScope);
        }

        lScope.push(lBinder);
        mOutput.append("\\#").append(lBinder).append('.');
        lWork.push(new ScopeExit(lParam));
        lWork.push(lLambda.getBody());
      }
      else
      {
        TermApplication lApp = (TermApplication)lNext;
        boolean lWrapFunction = lApp.getFunction() instanceof TermLambda;
        boolean lWrapArgument = !(lApp.getArgument() instanceof TermVariable);

        // Pushed in reverse order of printing.
        if (lWrapArgument)
        {
          lWork.push(")");
        }
        lWork.push(lApp.getArgument());
        lWork.push(lWrapArgument ? " (" : " ");
        if (lWrapFunction)
        {
          lWork.push(")");
        }
        lWork.push(lApp.getFunction());
        if (lWrapFunction)
        {
          lWork.push("(");
        }
      }
    }
  }

  /**
   * Work-stack marker for leaving the scope of a lambda parameter.
   */
  private static final class ScopeExit
  {
    final String mName;

    ScopeExit(String xiName)
    {
      mName = xiName;
    }
  }
}
