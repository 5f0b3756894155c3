package org.lambdaviz.base.util.term.transforms;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.term.TermUtils;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermPool;
import org.lambdaviz.base.util.term.grammar.TermVariable;

/**
 * Capture-avoiding substitution, <code>M[x := N]</code>.
 *
 * When the substitution passes under a lambda whose parameter occurs free in the replacement, the parameter is first
 * renamed to a fresh name (alpha-conversion) so that the replacement's free occurrence cannot be captured.  Every
 * renaming performed is recorded, so a caller can report it.
 *
 * An instance is single-use state for one substitution; use {@link #substitute(Term, String, Term)} when the renamings
 * are not needed.
 */
public final class Substituter
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final String       mVariable;
  private final Term         mReplacement;
  private final Set<String>  mReplacementFree;
  private final List<String> mRenamings = new ArrayList<>();

  /**
   * Create a substituter for <code>[xiVariable := xiReplacement]</code>.
   *
   * @param xiVariable    - the name of the variable to replace.
   * @param xiReplacement - the term to put in its place.
   */
  public Substituter(String xiVariable, Term xiReplacement)
  {
    mVariable = xiVariable;
    mReplacement = xiReplacement;
    mReplacementFree = TermUtils.getFreeVariables(xiReplacement);
  }

  /**
   * @return the result of substituting the replacement for every free occurrence of the variable in the term.
   *
   * @param xiTerm       - the term to substitute into.
   * @param xiVariable   - the name of the variable to replace.
   * @param xiReplacement - the replacement.
   */
  public static Term substitute(Term xiTerm, String xiVariable, Term xiReplacement)
  {
    return new Substituter(xiVariable, xiReplacement).apply(xiTerm);
  }

  /**
   * @return the result of applying this substitution to the term.
   *
   * @param xiTerm - the term to substitute into.
   */
  public Term apply(Term xiTerm)
  {
    // The tree is rebuilt bottom-up from an explicit task stack, so arbitrarily deep terms are safe.  Finished
    // sub-terms wait on the result stack until the task that assembles them runs.
    Deque<Object> lTasks = new ArrayDeque<>();
    Deque<Term> lResults = new ArrayDeque<>();
    lTasks.push(new Visit(this, xiTerm));

    while (!lTasks.isEmpty())
    {
      Object lTask = lTasks.pop();

      if (lTask instanceof Visit)
      {
        Visit lVisit = (Visit)lTask;
        lVisit.mSubstituter.visit(lVisit.mTerm, lTasks, lResults);
      }
      else if (lTask instanceof BuildApplication)
      {
        Term lArgument = lResults.pop();
        Term lFunction = lResults.pop();
        lResults.push(TermPool.getApplication(lFunction, lArgument));
      }
      else if (lTask instanceof BuildLambda)
      {
        lResults.push(TermPool.getLambda(((BuildLambda)lTask).mParameter, lResults.pop()));
      }
      else
      {
        lTasks.push(new Visit(((ApplyToResult)lTask).mSubstituter, lResults.pop()));
      }
    }

    return lResults.pop();
  }

  private void visit(Term xiTerm, Deque<Object> xoTasks, Deque<Term> xoResults)
  {
    if (xiTerm instanceof TermVariable)
    {
      xoResults.push(((TermVariable)xiTerm).getName().equals(mVariable) ? mReplacement : xiTerm);
      return;
    }

    if (xiTerm instanceof TermApplication)
    {
      // Function first, then argument, then join them.
      TermApplication lApp = (TermApplication)xiTerm;
      xoTasks.push(new BuildApplication());
      xoTasks.push(new Visit(this, lApp.getArgument()));
      xoTasks.push(new Visit(this, lApp.getFunction()));
      return;
    }

    TermLambda lLambda = (TermLambda)xiTerm;
    String lParam = lLambda.getParameter().getName();

    // Shadowed - nothing inside refers to the variable being replaced.
    if (lParam.equals(mVariable))
    {
      xoResults.push(lLambda);
      return;
    }

    if (!mReplacementFree.contains(lParam))
    {
      xoTasks.push(new BuildLambda(lLambda.getParameter()));
      xoTasks.push(new Visit(this, lLambda.getBody()));
      return;
    }

    // The replacement mentions the parameter freely, so rename the parameter before going inside.
    Set<String> lAvoid = new HashSet<>(TermUtils.getFreeVariables(lLambda.getBody()));
    lAvoid.addAll(mReplacementFree);
    lAvoid.add(mVariable);
    String lFresh = FreshNameGenerator.freshName(lAvoid);
    TermVariable lFreshVariable = TermPool.getVariable(lFresh);

    LOGGER.trace("Alpha-converting " + lParam + " to " + lFresh + " in " + lLambda);
    mRenamings.add(lParam + " -> " + lFresh);

    xoTasks.push(new BuildLambda(lFreshVariable));
    xoTasks.push(new ApplyToResult(this));
    xoTasks.push(new Visit(new Substituter(lParam, lFreshVariable), lLambda.getBody()));
  }

  /**
   * @return the alpha-renamings performed so far, each in the form <code>old -> new</code>.
   */
  public List<String> getRenamings()
  {
    return Collections.unmodifiableList(mRenamings);
  }

  /**
   * Substitute into a term and leave the result on the result stack.
   */
  private static final class Visit
  {
    final Substituter mSubstituter;
    final Term        mTerm;

    Visit(Substituter xiSubstituter, Term xiTerm)
    {
      mSubstituter = xiSubstituter;
      mTerm = xiTerm;
    }
  }

  /**
   * Replace the top two results (function below argument) with their application.
   */
  private static final class BuildApplication
  {
  }

  /**
   * Replace the top result with a lambda over it.
   */
  private static final class BuildLambda
  {
    final TermVariable mParameter;

    BuildLambda(TermVariable xiParameter)
    {
      mParameter = xiParameter;
    }
  }

  /**
   * Substitute into the top result (used after alpha-conversion of a lambda body).
   */
  private static final class ApplyToResult
  {
    final Substituter mSubstituter;

    ApplyToResult(Substituter xiSubstituter)
    {
      mSubstituter = xiSubstituter;
    }
  }
}
