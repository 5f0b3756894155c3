package org.lambdaviz.base.util.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.config.EngineConfiguration;
import org.lambdaviz.base.util.config.EngineConfiguration.CfgItem;
import org.lambdaviz.base.util.reducer.BetaReducer;
import org.lambdaviz.base.util.reducer.ReductionResult;
import org.lambdaviz.base.util.reducer.Strategy;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.lambdaviz.base.util.term.factory.exceptions.TermFormatException;
import org.lambdaviz.base.util.term.grammar.Term;

/**
 * The term engine's entry point: parse text into a term, and reduce a term to a traced result.
 *
 * Each call is a self-contained synchronous computation over its own term tree.  The only guard against
 * non-termination is the step bound; callers that need a wall-clock limit must impose it themselves.
 *
 * Parsing uses a fresh {@link TermFactory} per call, so an engine may be shared between threads.
 */
public class TermEngine
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final boolean     mStrictLexer;
  private final BetaReducer mReducer;

  /**
   * Create an engine configured from {@link EngineConfiguration}.
   */
  public TermEngine()
  {
    this(EngineConfiguration.getCfgBool(CfgItem.STRICT_LEXER), new BetaReducer());
  }

  /**
   * Create an engine.
   *
   * @param xiStrictLexer - whether unrecognised characters are rejected rather than dropped.
   * @param xiReducer     - the reducer to use.
   */
  public TermEngine(boolean xiStrictLexer, BetaReducer xiReducer)
  {
    mStrictLexer = xiStrictLexer;
    mReducer = xiReducer;
  }

  /**
   * Parse term text.
   *
   * @param xiText - the text.
   * @return the term.
   * @throws TermFormatException if the text is not exactly one well-formed term.  No partial term is ever returned.
   */
  public Term parse(String xiText) throws TermFormatException
  {
    return new TermFactory(mStrictLexer).parse(xiText);
  }

  /**
   * Reduce a term.  Never throws for any term: divergent input yields a bounded result with its partial trace.
   *
   * @param xiTerm     - the term.
   * @param xiStrategy - the strategy.
   * @param xiMaxSteps - the step bound (not negative).
   * @return the result.
   */
  public ReductionResult reduce(Term xiTerm, Strategy xiStrategy, int xiMaxSteps)
  {
    return mReducer.reduce(xiTerm, xiStrategy, xiMaxSteps);
  }

  /**
   * Parse and reduce in one call.
   *
   * @param xiText     - the term text.
   * @param xiStrategy - the strategy.
   * @param xiMaxSteps - the step bound (not negative).
   * @return the result.
   * @throws TermFormatException if the text is not exactly one well-formed term.
   */
  public ReductionResult evaluate(String xiText, Strategy xiStrategy, int xiMaxSteps) throws TermFormatException
  {
    Term lTerm = parse(xiText);
    ReductionResult lResult = reduce(lTerm, xiStrategy, xiMaxSteps);
    LOGGER.info("Reduced " + lResult.getOriginalTerm() + " in " + lResult.getStepsTaken() + " steps (" + xiStrategy +
                ")");
    return lResult;
  }

  /**
   * Parse and reduce using the configured default strategy and step bound.
   *
   * @param xiText - the term text.
   * @return the result.
   * @throws TermFormatException if the text is not exactly one well-formed term.
   */
  public ReductionResult evaluate(String xiText) throws TermFormatException
  {
    return evaluate(xiText, getDefaultStrategy(), getDefaultMaxSteps());
  }

  /**
   * @return the configured default strategy.
   */
  public static Strategy getDefaultStrategy()
  {
    return Strategy.fromName(EngineConfiguration.getCfgStr(CfgItem.DEFAULT_STRATEGY));
  }

  /**
   * @return the configured default step bound.
   */
  public static int getDefaultMaxSteps()
  {
    return EngineConfiguration.getCfgInt(CfgItem.DEFAULT_MAX_STEPS);
  }
}
