package org.lambdaviz.base.util.reducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Printed description of one contraction, for display alongside a trace entry.
 */
public final class RedexDescription
{
  private final List<PathStep> mPath;
  private final String         mRedex;
  private final String         mParameter;
  private final String         mArgument;
  private final String         mContractum;
  private final List<String>   mRenamings;

  /**
   * @param xiPath       - path from the root to the redex.
   * @param xiRedex      - the printed redex.
   * @param xiParameter  - the name bound by the redex's lambda.
   * @param xiArgument   - the printed argument.
   * @param xiContractum - the printed result of contracting the redex.
   * @param xiRenamings  - alpha-renamings performed during the substitution, each <code>old -> new</code>.
   */
  public RedexDescription(List<PathStep> xiPath,
                          String xiRedex,
                          String xiParameter,
                          String xiArgument,
                          String xiContractum,
                          List<String> xiRenamings)
  {
    mPath = Collections.unmodifiableList(new ArrayList<>(xiPath));
    mRedex = xiRedex;
    mParameter = xiParameter;
    mArgument = xiArgument;
    mContractum = xiContractum;
    mRenamings = Collections.unmodifiableList(new ArrayList<>(xiRenamings));
  }

  public List<PathStep> getPath()
  {
    return mPath;
  }

  public String getRedex()
  {
    return mRedex;
  }

  public String getParameter()
  {
    return mParameter;
  }

  public String getArgument()
  {
    return mArgument;
  }

  public String getContractum()
  {
    return mContractum;
  }

  public List<String> getRenamings()
  {
    return mRenamings;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    sb.append(mRedex + " -> " + mContractum);
    sb.append(" [" + mParameter + " := " + mArgument + "]");
    sb.append(" at " + (mPath.isEmpty() ? "<root>" : mPath.toString()));
    if (!mRenamings.isEmpty())
    {
      sb.append(" renaming " + mRenamings);
    }
    return sb.toString();
  }
}
