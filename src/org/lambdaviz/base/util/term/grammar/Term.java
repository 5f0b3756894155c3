package org.lambdaviz.base.util.term.grammar;

import java.io.Serializable;

/**
 * Class at the root of the term hierarchy.  Every lambda-calculus expression handled by the engine is represented by
 * an object that is part of this hierarchy.
 *
 * <h1>The term hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Variable</b>: A reference to a binder, written as an identifier (a letter followed by letters or digits).
 *     See {@link TermVariable}.
 *
 * <li><b>Lambda</b>: An abstraction, written <code>\x.body</code> or <code>&lambda;x.body</code>.  The parameter
 *     scopes over every occurrence of the same name inside the body that is not re-bound by a nested lambda with the
 *     same parameter name.  See {@link TermLambda}.
 *
 * <li><b>Application</b>: The juxtaposition of two terms, <code>function argument</code>.  Application is
 *     left-associative, so <code>f x y</code> is <code>(f x) y</code>.  See {@link TermApplication}.
 *
 * </ul>
 *
 * <h1>Other terms</h1>
 *
 * <ul>
 *   <li><b>Free variable</b>: A variable occurrence not bound by any enclosing lambda with a matching parameter name.
 *   <li><b>Bound variable</b>: A parameter name introduced by any lambda in the term, whether or not it is referenced.
 *   <li><b>Closed</b>: A term is <i>closed</i> if it has no free variables.  Closed terms are also called
 *       <i>combinators</i>.
 *   <li><b>Redex</b>: An application whose function is a lambda.
 * </ul>
 *
 * Terms are immutable.  Every substitution or reduction step builds a new tree, so sub-terms may be shared freely
 * between trees.  Derived properties (free variables, bound variables, closedness) are always recomputed and never
 * stored; only the hash code is fixed at construction.  Nothing that walks a term recurses on its structure, so
 * terms of any depth can be printed, compared and reduced.
 *
 * <h1>Worked example</h1>
 *
 * <p><pre>{@code
 * (\x.\y.x) a b}</pre>
 *
 * <ul>
 *   <li>The whole thing is an <i>application</i> whose function is <code>(\x.\y.x) a</code> and whose argument is the
 *       <i>variable</i> <code>b</code>.
 *   <ul>
 *     <li><code>(\x.\y.x) a</code> is an <i>application</i> and a <i>redex</i>, because its function is the
 *         <i>lambda</i> <code>\x.\y.x</code>.
 *     <ul>
 *       <li><code>\x.\y.x</code> binds <code>x</code>.  Its body is the <i>lambda</i> <code>\y.x</code>, which binds
 *           <code>y</code> and refers to the outer <code>x</code>.
 *       <li><code>a</code> is a free <i>variable</i>.
 *     </ul>
 *   </ul>
 * </ul>
 *
 * Terms are created through {@link TermPool}, never directly.
 */
@SuppressWarnings("serial")
public abstract class Term implements Serializable
{
  /**
   * @return whether this term is closed - i.e. has no free variables.
   */
  public abstract boolean isClosed();

  /**
   * Append the canonical printed form of this term.
   *
   * @param xoBuffer - the buffer to append to.
   */
  void appendTo(StringBuilder xoBuffer)
  {
    TermWalker.print(this, xoBuffer);
  }

  /**
   * @return the canonical printed form of this term.  Printing and re-parsing yields a structurally equal term.
   */
  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Term))
    {
      return false;
    }
    return TermWalker.equal(this, (Term)xiOther);
  }

  @Override
  public abstract int hashCode();
}
