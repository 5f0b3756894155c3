package org.lambdaviz.base.util.term.transforms;

import java.util.Set;

/**
 * Deterministic fresh-name source for alpha-conversion.  Given the same set of names to avoid it always returns the
 * same name: the first unused single lower-case letter, then <code>x0</code>, <code>x1</code>, ...
 */
public final class FreshNameGenerator
{
  private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";

  private FreshNameGenerator()
  {
  }

  /**
   * @return a variable name that is not in the avoid set.
   *
   * @param xiAvoid - names that must not be returned.
   */
  public static String freshName(Set<String> xiAvoid)
  {
    for (int lii = 0; lii < LETTERS.length(); lii++)
    {
      String lCandidate = String.valueOf(LETTERS.charAt(lii));
      if (!xiAvoid.contains(lCandidate))
      {
        return lCandidate;
      }
    }

    for (int lSuffix = 0; ; lSuffix++)
    {
      String lCandidate = "x" + lSuffix;
      if (!xiAvoid.contains(lCandidate))
      {
        return lCandidate;
      }
    }
  }
}
