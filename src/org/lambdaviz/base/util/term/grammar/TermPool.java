package org.lambdaviz.base.util.term.grammar;

/**
 * Factory for all {@link Term} objects.  Constructors in the hierarchy are package-private so that every term is
 * created (and validated) here.
 *
 * Only variable names are interned.  Terms themselves are short-lived values owned by a single reduction call.
 */
public final class TermPool
{
  /**
   * The Unicode lambda glyph, accepted as an alternative abstraction marker and therefore never part of a name.
   */
  public static final char LAMBDA_GLYPH = '\u03BB';

  private TermPool()
  {
  }

  /**
   * @return whether the specified name is a valid identifier: a letter followed by letters or digits.
   *
   * @param xiName - the candidate name.
   */
  public static boolean isValidName(String xiName)
  {
    if ((xiName == null) || xiName.isEmpty() || !isNameStart(xiName.charAt(0)))
    {
      return false;
    }

    for (int lii = 1; lii < xiName.length(); lii++)
    {
      if (!isNameCharacter(xiName.charAt(lii)))
      {
        return false;
      }
    }

    return true;
  }

  /**
   * @return whether the character may start a name.
   */
  public static boolean isNameStart(char xiChar)
  {
    return Character.isLetter(xiChar) && (xiChar != LAMBDA_GLYPH);
  }

  /**
   * @return whether the character may continue a name.
   */
  public static boolean isNameCharacter(char xiChar)
  {
    return Character.isLetterOrDigit(xiChar) && (xiChar != LAMBDA_GLYPH);
  }

  /**
   * @return a variable with the specified name.
   *
   * @param xiName - the variable name.
   *
   * @throws IllegalArgumentException if the name is not a valid identifier.
   */
  public static TermVariable getVariable(String xiName)
  {
    if (!isValidName(xiName))
    {
      throw new IllegalArgumentException("Invalid variable name: '" + xiName + "'");
    }
    return new TermVariable(xiName);
  }

  /**
   * @return an abstraction of the body over the parameter.
   *
   * @param xiParameter - the bound variable.
   * @param xiBody      - the body.
   */
  public static TermLambda getLambda(TermVariable xiParameter, Term xiBody)
  {
    if ((xiParameter == null) || (xiBody == null))
    {
      throw new IllegalArgumentException("A lambda needs both a parameter and a body");
    }
    return new TermLambda(xiParameter, xiBody);
  }

  /**
   * @return an abstraction of the body over a parameter with the specified name.
   */
  public static TermLambda getLambda(String xiParameter, Term xiBody)
  {
    return getLambda(getVariable(xiParameter), xiBody);
  }

  /**
   * @return the application of the function to the argument.
   *
   * @param xiFunction - the function.
   * @param xiArgument - the argument.
   */
  public static TermApplication getApplication(Term xiFunction, Term xiArgument)
  {
    if ((xiFunction == null) || (xiArgument == null))
    {
      throw new IllegalArgumentException("An application needs both a function and an argument");
    }
    return new TermApplication(xiFunction, xiArgument);
  }
}
