package org.lambdaviz.base.util.reducer.classifier;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lambdaviz.base.util.term.factory.TermFactory;
import org.lambdaviz.base.util.term.factory.exceptions.TermFormatException;
import org.lambdaviz.base.util.term.grammar.Term;
import org.lambdaviz.base.util.term.transforms.AlphaNormalizer;

/**
 * Recognises terms that are alpha-equivalent to one of the {@link Combinator}s.
 *
 * Matching compares canonical forms (see {@link AlphaNormalizer}), so <code>\a.a</code> is recognised as I.  It is
 * still purely syntactic beyond renaming: a term that merely beta-reduces to a combinator does not match.
 */
public final class CombinatorClassifier
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Map<String, Combinator> CANONICAL_FORMS = new LinkedHashMap<>();
  static
  {
    TermFactory lFactory = new TermFactory(true);
    for (Combinator lCombinator : Combinator.values())
    {
      try
      {
        String lForm = AlphaNormalizer.canonicalForm(lFactory.parse(lCombinator.getExpression()));
        if (!CANONICAL_FORMS.containsKey(lForm))
        {
          CANONICAL_FORMS.put(lForm, lCombinator);
        }
      }
      catch (TermFormatException lEx)
      {
        throw new IllegalStateException("Bad built-in combinator " + lCombinator, lEx);
      }
    }
    LOGGER.trace("Loaded " + CANONICAL_FORMS.size() + " combinator forms");
  }

  private CombinatorClassifier()
  {
  }

  /**
   * @return the combinator the term is alpha-equivalent to, or null if it matches none.
   *
   * @param xiTerm - the term to classify.
   */
  public static Combinator classify(Term xiTerm)
  {
    if (!xiTerm.isClosed())
    {
      return null;
    }
    return CANONICAL_FORMS.get(AlphaNormalizer.canonicalForm(xiTerm));
  }

  /**
   * @return the display name of the combinator the term matches, "Church n" for any other Church numeral, or null.
   *
   * @param xiTerm - the term to describe.
   */
  public static String describe(Term xiTerm)
  {
    Combinator lCombinator = classify(xiTerm);
    if (lCombinator != null)
    {
      return lCombinator.getDisplayName();
    }

    int lNumeral = churchNumeralValue(xiTerm);
    return (lNumeral >= 0) ? "Church " + lNumeral : null;
  }

  /**
   * @return whether the term is a Church numeral, and if so which: the numeral's value, or -1 if it is not one.
   *         Unlike {@link #classify(Term)} this is not limited to the numerals in the table.
   */
  public static int churchNumeralValue(Term xiTerm)
  {
    String lForm = AlphaNormalizer.canonicalForm(xiTerm);

    // \#0.\#1.#1, or \#0.\#1.#0 (#0 (... (#0 #1)...)) with one fewer ')' than applications of #0.
    String lPrefix = "\\#0.\\#1.";
    if (!lForm.startsWith(lPrefix))
    {
      return -1;
    }
    if ((lForm.length() == lPrefix.length() + 2) && lForm.endsWith("#1"))
    {
      return 0;
    }

    int lIndex = lPrefix.length();
    int lNested = 0;
    while (lForm.startsWith("#0 (", lIndex))
    {
      lIndex += 4;
      lNested++;
    }

    if (!lForm.startsWith("#0 #1", lIndex))
    {
      return -1;
    }
    lIndex += 5;

    if (lForm.length() != lIndex + lNested)
    {
      return -1;
    }
    for (; lIndex < lForm.length(); lIndex++)
    {
      if (lForm.charAt(lIndex) != ')')
      {
        return -1;
      }
    }

    return lNested + 1;
  }
}
