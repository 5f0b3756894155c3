package org.lambdaviz.base.util.term.factory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.config.EngineConfiguration;
import org.lambdaviz.base.util.config.EngineConfiguration.CfgItem;
import org.lambdaviz.base.util.term.factory.TermToken.Type;
import org.lambdaviz.base.util.term.factory.exceptions.TermFormatException;
import org.lambdaviz.base.util.term.factory.exceptions.TermParseException;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.grammar.TermPool;
import org.lambdaviz.base.util.term.grammar.TermVariable;

/**
 * Parser from term text to a {@link Term}.
 *
 * <pre>
 * term        := application
 * application := atom (atom)*
 * atom        := VAR | '(' term ')' | LAMBDA VAR '.' term
 * </pre>
 *
 * Application is left-associative.  A lambda body is parsed as a full term, so it extends as far right as possible.
 * Parentheses only group and leave no trace in the tree.  The whole token sequence must be consumed.
 *
 * The parser does not recurse: open groups and lambda bodies are kept on a stack, so input nested to any depth is
 * either parsed or rejected with a positioned {@link TermParseException}.
 */
public final class TermFactory
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final TermLexer mLexer;

  private List<TermToken> mTokens;
  private int             mPosition;
  private int             mInputLength;

  /**
   * Create a parser whose lexer strictness comes from {@link CfgItem#STRICT_LEXER}.
   */
  public TermFactory()
  {
    this(EngineConfiguration.getCfgBool(CfgItem.STRICT_LEXER));
  }

  /**
   * Create a parser.
   *
   * @param xiStrictLexer - whether unrecognised characters are rejected rather than dropped.
   */
  public TermFactory(boolean xiStrictLexer)
  {
    mLexer = new TermLexer(xiStrictLexer);
  }

  /**
   * Convenience method to parse text with the configured lexer strictness.
   *
   * @param xiText - the term text.
   * @return the term.
   * @throws TermFormatException if the text is not exactly one well-formed term.
   */
  public static Term createTerm(String xiText) throws TermFormatException
  {
    return new TermFactory().parse(xiText);
  }

  /**
   * Parse term text.  Not thread-safe - use one factory per thread.
   *
   * @param xiText - the term text.
   * @return the term.
   * @throws TermFormatException if the text is not exactly one well-formed term.
   */
  public Term parse(String xiText) throws TermFormatException
  {
    mTokens = mLexer.tokenize(xiText);
    mPosition = 0;
    mInputLength = xiText.length();

    Term lTerm = parseTokens();

    LOGGER.debug("Parsed '" + xiText + "' as " + lTerm);
    return lTerm;
  }

  /**
   * A term under construction: the whole input, a parenthesised group or a lambda body.  Each holds the application
   * built so far from its atoms.
   */
  private static final class Frame
  {
    final Type         mOpener;
    final TermVariable mParameter;
    Term               mApplication;

    Frame(Type xiOpener, TermVariable xiParameter)
    {
      mOpener = xiOpener;
      mParameter = xiParameter;
    }

    void addAtom(Term xiAtom)
    {
      mApplication = (mApplication == null) ? xiAtom : TermPool.getApplication(mApplication, xiAtom);
    }
  }

  /**
   * Parse the token sequence.  Nesting is tracked on an explicit stack of frames, so the depth of the input is
   * limited only by memory.
   */
  private Term parseTokens() throws TermParseException
  {
    Deque<Frame> lFrames = new ArrayDeque<>();
    lFrames.push(new Frame(null, null));

    while (true)
    {
      TermToken lToken = peek();

      if (startsAtom(lToken))
      {
        mPosition++;
        switch (lToken.getType())
        {
          case IDENTIFIER:
            lFrames.peek().addAtom(TermPool.getVariable(lToken.getText()));
            break;

          case OPEN_PAREN:
            lFrames.push(new Frame(Type.OPEN_PAREN, null));
            break;

          default:
          {
            TermToken lParamToken = expect(Type.IDENTIFIER, "parameter name after lambda");
            expect(Type.DOT, "'.' after lambda parameter");
            lFrames.push(new Frame(Type.LAMBDA, TermPool.getVariable(lParamToken.getText())));
            break;
          }
        }
        continue;
      }

      // Anything else ends the current application, and with it every lambda body open inside the innermost group.
      if (lFrames.peek().mApplication == null)
      {
        throw unexpected("variable, '(' or lambda", lToken);
      }
      while (lFrames.peek().mOpener == Type.LAMBDA)
      {
        Frame lLambda = lFrames.pop();
        lFrames.peek().addAtom(TermPool.getLambda(lLambda.mParameter, lLambda.mApplication));
      }

      Frame lInnermost = lFrames.peek();
      if (lInnermost.mOpener == Type.OPEN_PAREN)
      {
        if ((lToken == null) || (lToken.getType() != Type.CLOSE_PAREN))
        {
          throw unexpected("')'", lToken);
        }
        mPosition++;
        lFrames.pop();
        lFrames.peek().addAtom(lInnermost.mApplication);
      }
      else if (lToken != null)
      {
        throw new TermParseException(lToken.getOffset(), TermParseException.END_OF_INPUT, lToken.getText());
      }
      else
      {
        return lInnermost.mApplication;
      }
    }
  }

  private TermToken expect(Type xiType, String xiExpected) throws TermParseException
  {
    TermToken lToken = peek();
    if ((lToken == null) || (lToken.getType() != xiType))
    {
      throw unexpected(xiExpected, lToken);
    }
    mPosition++;
    return lToken;
  }

  private TermParseException unexpected(String xiExpected, TermToken xiFound)
  {
    if (xiFound == null)
    {
      return new TermParseException(mInputLength, xiExpected, TermParseException.END_OF_INPUT);
    }
    return new TermParseException(xiFound.getOffset(), xiExpected, xiFound.getText());
  }

  private TermToken peek()
  {
    return (mPosition < mTokens.size()) ? mTokens.get(mPosition) : null;
  }

  private static boolean startsAtom(TermToken xiToken)
  {
    if (xiToken == null)
    {
      return false;
    }
    Type lType = xiToken.getType();
    return (lType == Type.IDENTIFIER) || (lType == Type.OPEN_PAREN) || (lType == Type.LAMBDA);
  }
}
