package org.lambdaviz.base.util.term.grammar;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Printing and structural comparison of terms.  Both work from an explicit stack rather than by recursion, because
 * reduction routinely produces terms many thousands of levels deep.
 */
final class TermWalker
{
  private TermWalker()
  {
  }

  /**
   * Append the canonical print of a term.
   *
   * @param xiTerm   - the term.
   * @param xoBuffer - the buffer to append to.
   */
  static void print(Term xiTerm, StringBuilder xoBuffer)
  {
    // Entries are either terms still to print or literal text.
    Deque<Object> lWork = new ArrayDeque<>();
    lWork.push(xiTerm);

    while (!lWork.isEmpty())
    {
      Object lNext = lWork.pop();

      if (lNext instanceof String)
      {
        xoBuffer.append((String)lNext);
      }
      else if (lNext instanceof TermVariable)
      {
        xoBuffer.append(((TermVariable)lNext).getName());
      }
      else if (lNext instanceof TermLambda)
      {
        TermLambda lLambda = (TermLambda)lNext;
        xoBuffer.append('\\').append(lLambda.getParameter().getName()).append('.');
        lWork.push(lLambda.getBody());
      }
      else
      {
        TermApplication lApp = (TermApplication)lNext;
        Term lFunction = lApp.getFunction();
        Term lArgument = lApp.getArgument();

        // Pushed in reverse order of printing.  A lambda in function position would otherwise swallow the argument
        // into its body.
        boolean lWrapArgument = (lArgument instanceof TermApplication) || (lArgument instanceof TermLambda);
        if (lWrapArgument)
        {
          lWork.push(")");
        }
        lWork.push(lArgument);
        lWork.push(lWrapArgument ? " (" : " ");

        if (lFunction instanceof TermLambda)
        {
          lWork.push(")");
          lWork.push(lFunction);
          lWork.push("(");
        }
        else
        {
          lWork.push(lFunction);
        }
      }
    }
  }

  /**
   * @return whether two terms have the same structure and names.
   */
  static boolean equal(Term xiA, Term xiB)
  {
    Deque<Term> lLeft = new ArrayDeque<>();
    Deque<Term> lRight = new ArrayDeque<>();
    lLeft.push(xiA);
    lRight.push(xiB);

    while (!lLeft.isEmpty())
    {
      Term lA = lLeft.pop();
      Term lB = lRight.pop();

      if (lA == lB)
      {
        continue;
      }
      if ((lA.getClass() != lB.getClass()) || (lA.hashCode() != lB.hashCode()))
      {
        return false;
      }

      if (lA instanceof TermVariable)
      {
        if (!((TermVariable)lA).getName().equals(((TermVariable)lB).getName()))
        {
          return false;
        }
      }
      else if (lA instanceof TermLambda)
      {
        TermLambda lLambdaA = (TermLambda)lA;
        TermLambda lLambdaB = (TermLambda)lB;
        if (!lLambdaA.getParameter().getName().equals(lLambdaB.getParameter().getName()))
        {
          return false;
        }
        lLeft.push(lLambdaA.getBody());
        lRight.push(lLambdaB.getBody());
      }
      else
      {
        TermApplication lAppA = (TermApplication)lA;
        TermApplication lAppB = (TermApplication)lB;
        lLeft.push(lAppA.getArgument());
        lRight.push(lAppB.getArgument());
        lLeft.push(lAppA.getFunction());
        lRight.push(lAppB.getFunction());
      }
    }

    return true;
  }
}
