package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.config.EngineConfiguration;
import org.lambdaviz.base.util.config.EngineConfiguration.CfgItem;
import org.lambdaviz.base.util.reducer.classifier.CombinatorClassifier;
import org.lambdaviz.base.util.term.TermUtils;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermApplication;
import org.lambdaviz.base.util.term.grammar.TermLambda;
import org.lambdaviz.base.util.term.grammar.TermPool;
import org.lambdaviz.base.util.term.transforms.Substituter;

/**
 * Beta reduction driver.
 *
 * A single {@link #step} finds the next redex under a strategy and contracts it.  {@link #reduce} repeats that until
 * one of:
 * <ul>
 *   <li>no redex remains (normal form);
 *   <li>the step bound is used up;
 *   <li>the last {@link CfgItem#STAGNATION_WINDOW} snapshots print identically, which is taken as non-termination.
 * </ul>
 *
 * Reduction never throws for any term - non-termination is reported in the result.  A reducer holds no per-run state,
 * so one instance may be shared between threads.
 */
public class BetaReducer
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final int     mStagnationWindow;
  private final boolean mClassify;

  /**
   * Create a reducer configured from {@link EngineConfiguration}.
   */
  public BetaReducer()
  {
    this(EngineConfiguration.getCfgInt(CfgItem.STAGNATION_WINDOW),
         EngineConfiguration.getCfgBool(CfgItem.CLASSIFY_COMBINATORS));
  }

  /**
   * Create a reducer.
   *
   * @param xiStagnationWindow - number of identical trailing snapshots that stops a run (values below 2 disable the
   *                             guard).
   * @param xiClassify         - whether to classify final terms against the known combinators.
   */
  public BetaReducer(int xiStagnationWindow, boolean xiClassify)
  {
    mStagnationWindow = xiStagnationWindow;
    mClassify = xiClassify;
  }

  /**
   * Perform one beta step.
   *
   * @param xiTerm     - the term to reduce.
   * @param xiStrategy - the redex search order.
   *
   * @return the new term with a description of the contracted redex, or null if the term is in normal form for this
   *         strategy.
   */
  public ReductionStep step(Term xiTerm, Strategy xiStrategy)
  {
    Redex lRedex = xiStrategy.getRedexFinder().findRedex(xiTerm);
    if (lRedex == null)
    {
      return null;
    }

    TermLambda lLambda = lRedex.getLambda();
    Term lArgument = lRedex.getApplication().getArgument();

    Substituter lSubstituter = new Substituter(lLambda.getParameter().getName(), lArgument);
    Term lContractum = lSubstituter.apply(lLambda.getBody());

    Term lResult = replaceAt(xiTerm, lRedex.getPath(), lContractum);

    RedexDescription lDescription = new RedexDescription(lRedex.getPath(),
                                                         lRedex.getApplication().toString(),
                                                         lLambda.getParameter().getName(),
                                                         lArgument.toString(),
                                                         lContractum.toString(),
                                                         lSubstituter.getRenamings());
    return new ReductionStep(lResult, lDescription);
  }

  /**
   * @return whether the term has no redex under the strategy.
   */
  public boolean isNormalForm(Term xiTerm, Strategy xiStrategy)
  {
    return xiStrategy.getRedexFinder().findRedex(xiTerm) == null;
  }

  /**
   * Reduce a term as far as the strategy and bound allow.
   *
   * @param xiTerm     - the term to reduce.
   * @param xiStrategy - the redex search order.
   * @param xiMaxSteps - the maximum number of beta steps to perform.
   *
   * @return the result, including the full trace.
   */
  public ReductionResult reduce(Term xiTerm, Strategy xiStrategy, int xiMaxSteps)
  {
    if ((xiTerm == null) || (xiStrategy == null))
    {
      throw new IllegalArgumentException("Term and strategy must both be specified");
    }
    if (xiMaxSteps < 0)
    {
      throw new IllegalArgumentException("Step bound must not be negative: " + xiMaxSteps);
    }

    List<TraceEntry> lTrace = new ArrayList<>();
    lTrace.add(snapshot(0, xiTerm, null));

    Term lCurrent = xiTerm;
    int lSteps = 0;
    boolean lStagnant = false;
    boolean lNormalForm = false;

    while (true)
    {
      if (lSteps >= xiMaxSteps)
      {
        lNormalForm = isNormalForm(lCurrent, xiStrategy);
        break;
      }

      ReductionStep lStep = step(lCurrent, xiStrategy);
      if (lStep == null)
      {
        lNormalForm = true;
        break;
      }

      lCurrent = lStep.getTerm();
      lSteps++;
      lTrace.add(snapshot(lSteps, lCurrent, lStep.getDescription()));
      LOGGER.debug("Step " + lSteps + ": " + lStep.getDescription());

      if (isStagnant(lTrace))
      {
        LOGGER.warn("Detected potential infinite loop after " + lSteps + " steps reducing " + xiTerm + ", stopping");
        lStagnant = true;
        break;
      }
    }

    boolean lBounded = !lNormalForm;

    String lCombinator = mClassify ? CombinatorClassifier.describe(lCurrent) : null;

    ReductionResult lResult = new ReductionResult(xiTerm.toString(),
                                                  lCurrent,
                                                  lNormalForm,
                                                  lSteps,
                                                  lBounded,
                                                  lStagnant,
                                                  xiStrategy,
                                                  lCombinator,
                                                  lTrace);
    LOGGER.debug("Reduction complete: " + lResult);
    return lResult;
  }

  private static TraceEntry snapshot(int xiIndex, Term xiTerm, RedexDescription xiRedex)
  {
    return new TraceEntry(xiIndex,
                          xiTerm.toString(),
                          xiRedex,
                          TermUtils.getFreeVariables(xiTerm),
                          TermUtils.getBoundVariables(xiTerm));
  }

  private boolean isStagnant(List<TraceEntry> xiTrace)
  {
    if ((mStagnationWindow < 2) || (xiTrace.size() < mStagnationWindow))
    {
      return false;
    }

    String lLast = xiTrace.get(xiTrace.size() - 1).getTerm();
    for (int lii = xiTrace.size() - mStagnationWindow; lii < xiTrace.size() - 1; lii++)
    {
      if (!xiTrace.get(lii).getTerm().equals(lLast))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return a copy of the term with the sub-term at the path replaced.  Only the nodes along the path are rebuilt.
   */
  private static Term replaceAt(Term xiTerm, List<PathStep> xiPath, Term xiReplacement)
  {
    // Walk down, remembering every node on the path...
    Term[] lAncestors = new Term[xiPath.size()];
    Term lCurrent = xiTerm;
    for (int lii = 0; lii < xiPath.size(); lii++)
    {
      lAncestors[lii] = lCurrent;
      switch (xiPath.get(lii))
      {
        case FUNCTION:
          lCurrent = ((TermApplication)lCurrent).getFunction();
          break;

        case ARGUMENT:
          lCurrent = ((TermApplication)lCurrent).getArgument();
          break;

        default:
          lCurrent = ((TermLambda)lCurrent).getBody();
          break;
      }
    }

    // ...then rebuild from the bottom up.
    Term lResult = xiReplacement;
    for (int lii = xiPath.size() - 1; lii >= 0; lii--)
    {
      switch (xiPath.get(lii))
      {
        case FUNCTION:
          lResult = TermPool.getApplication(lResult, ((TermApplication)lAncestors[lii]).getArgument());
          break;

        case ARGUMENT:
          lResult = TermPool.getApplication(((TermApplication)lAncestors[lii]).getFunction(), lResult);
          break;

        default:
          lResult = TermPool.getLambda(((TermLambda)lAncestors[lii]).getParameter(), lResult);
          break;
      }
    }

    return lResult;
  }
}
