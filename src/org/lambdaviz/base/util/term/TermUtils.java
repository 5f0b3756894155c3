package org.lambdaviz.base.util.term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermVariable;
import org.lambdaviz.base.util.term.transforms.AlphaNormalizer;

/**
 * Structural queries over terms.  Nothing here is cached - every call walks the tree.
 *
 * The walks use an explicit stack, so they are safe on terms of any depth.
 */
public final class TermUtils
{
  private TermUtils()
  {
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

  /**
   * @return the names of the variables occurring free in the term, in order of first occurrence.
   *
   * @param xiTerm - the term.
   */
  public static Set<String> getFreeVariables(Term xiTerm)
  {
    Set<String> lFree = new LinkedHashSet<>();

    // Number of enclosing lambdas binding each name.  Shadowing lambdas stack up.
    Map<String, Integer> lBindings = new HashMap<>();

    Deque<Object> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Object lNext = lWork.pop();

      if (lNext instanceof ScopeExit)
      {
        String lName = ((ScopeExit)lNext).mName;
        int lCount = lBindings.get(lName);
        if (lCount == 1)
        {
          lBindings.remove(lName);
        }
        else
        {
          lBindings.put(lName, lCount - 1);
        }
      }
      else if (lNext instanceof TermVariable)
      {
        String lName = ((TermVariable)lNext).getName();
        if (!lBindings.containsKey(lName))
        {
          lFree.add(lName);
        }
      }
      else if (lNext instanceof TermLambda)
      {
        TermLambda lLambda = (TermLambda)lNext;
        String lParam = lLambda.getParameter().getName();
        Integer lCount = lBindings.get(lParam);
        lBindings.put(lParam, (lCount == null) ? 1 : lCount + 1);

        lWork.push(new ScopeExit(lParam));
        lWork.push(lLambda.getBody());
      }
      else
      {
        TermApplication lApp = (TermApplication)lNext;
        lWork.push(lApp.getArgument());
        lWork.push(lApp.getFunction());
      }
    }

    return lFree;
  }

  /**
   * @return whether the named variable occurs free in the term.
   */
  public static boolean isFreeIn(String xiName, Term xiTerm)
  {
    return getFreeVariables(xiTerm).contains(xiName);
  }

  /**
   * @return the parameter names of every lambda in the term, whether or not they are referenced, in order of first
   *         occurrence.
   *
   * @param xiTerm - the term.
   */
  public static Set<String> getBoundVariables(Term xiTerm)
  {
    Set<String> lBound = new LinkedHashSet<>();

    Deque<Term> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Term lNext = lWork.pop();
      if (lNext instanceof TermLambda)
      {
        TermLambda lLambda = (TermLambda)lNext;
        lBound.add(lLambda.getParameter().getName());
        lWork.push(lLambda.getBody());
      }
      else if (lNext instanceof TermApplication)
      {
        TermApplication lApp = (TermApplication)lNext;
        lWork.push(lApp.getArgument());
        lWork.push(lApp.getFunction());
      }
    }

    return lBound;
  }

  /**
   * @return the number of lambdas in the term.
   */
  public static int countLambdas(Term xiTerm)
  {
    int lCount = 0;

    Deque<Term> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Term lNext = lWork.pop();
      if (lNext instanceof TermLambda)
      {
        lCount++;
        lWork.push(((TermLambda)lNext).getBody());
      }
      else if (lNext instanceof TermApplication)
      {
        TermApplication lApp = (TermApplication)lNext;
        lWork.push(lApp.getArgument());
        lWork.push(lApp.getFunction());
      }
    }

    return lCount;
  }

  /**
   * @return the number of nodes in the term.
   */
  public static int size(Term xiTerm)
  {
    int lSize = 0;

    Deque<Term> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Term lNext = lWork.pop();
      lSize++;
      if (lNext instanceof TermLambda)
      {
        lWork.push(((TermLambda)lNext).getBody());
      }
      else if (lNext instanceof TermApplication)
      {
        TermApplication lApp = (TermApplication)lNext;
        lWork.push(lApp.getArgument());
        lWork.push(lApp.getFunction());
      }
    }

    return lSize;
  }

  /**
   * @return the depth of the term tree (a lone variable has depth 1).
   */
  public static int depth(Term xiTerm)
  {
    int lDeepest = 0;

    Deque<Term> lWork = new ArrayDeque<>();
    Deque<Integer> lDepths = new ArrayDeque<>();
    lWork.push(xiTerm);
    lDepths.push(1);

    while (!lWork.isEmpty())
    {
      Term lNext = lWork.pop();
      int lDepth = lDepths.pop();
      lDeepest = Math.max(lDeepest, lDepth);

      if (lNext instanceof TermLambda)
      {
        lWork.push(((TermLambda)lNext).getBody());
        lDepths.push(lDepth + 1);
      }
      else if (lNext instanceof TermApplication)
      {
        TermApplication lApp = (TermApplication)lNext;
        lWork.push(lApp.getArgument());
        lDepths.push(lDepth + 1);
        lWork.push(lApp.getFunction());
        lDepths.push(lDepth + 1);
      }
    }

    return lDeepest;
  }

  /**
   * @return whether the two terms are equal up to the renaming of bound variables.
   */
  public static boolean alphaEquivalent(Term xiA, Term xiB)
  {
    return AlphaNormalizer.canonicalForm(xiA).equals(AlphaNormalizer.canonicalForm(xiB));
  }
}
