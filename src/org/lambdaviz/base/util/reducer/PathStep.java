package org.lambdaviz.base.util.reducer;

/**
 * One step on the path from the root of a term to a sub-term.
 */
public enum PathStep
{
  /**
   * Into the function of an application.
   */
  FUNCTION("function"),

  /**
   * Into the argument of an application.
   */
  ARGUMENT("argument"),

  /**
   * Into the body of a lambda.
   */
  BODY("body");

  private final String mLabel;

  private PathStep(String xiLabel)
  {
    mLabel = xiLabel;
  }

  @Override
  public String toString()
  {
    return mLabel;
  }
}
