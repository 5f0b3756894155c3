package org.lambdaviz.base.util.reducer.classifier;

/**
 * Known closed terms, in the order in which they are tried.  Where two entries are alpha-equivalent only the first
 * can ever match, so Church 0 (<code>\f.\x.x</code>) is reported as {@link #KI}.
 */
public enum Combinator
{
  I("I (Identity)", "\\x.x"),
  K("K (Constant)", "\\x.\\y.x"),
  KI("KI (False / Church 0)", "\\x.\\y.y"),
  S("S (Substitution)", "\\x.\\y.\\z.x z (y z)"),
  B("B (Composition)", "\\f.\\g.\\x.f (g x)"),
  C("C (Flip)", "\\f.\\x.\\y.f y x"),
  W("W (Duplication)", "\\f.\\x.f x x"),
  M("M (Self-application)", "\\x.x x"),
  Y("Y (Fixed-point)", "\\f.(\\x.f (x x)) (\\x.f (x x))"),
  OMEGA("Omega", "(\\x.x x) (\\x.x x)"),
  CHURCH_1("Church 1", "\\f.\\x.f x"),
  CHURCH_2("Church 2", "\\f.\\x.f (f x)"),
  CHURCH_3("Church 3", "\\f.\\x.f (f (f x))"),
  CHURCH_4("Church 4", "\\f.\\x.f (f (f (f x)))"),
  CHURCH_5("Church 5", "\\f.\\x.f (f (f (f (f x))))");

  private final String mDisplayName;
  private final String mExpression;

  private Combinator(String xiDisplayName, String xiExpression)
  {
    mDisplayName = xiDisplayName;
    mExpression = xiExpression;
  }

  /**
   * @return the name reported in reduction results.
   */
  public String getDisplayName()
  {
    return mDisplayName;
  }

  /**
   * @return the conventional expression for this combinator, in term syntax.
   */
  public String getExpression()
  {
    return mExpression;
  }
}
