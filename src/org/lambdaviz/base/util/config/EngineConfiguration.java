package org.lambdaviz.base.util.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to engine configuration.
 *
 * Values come from a properties file: the one named by the <code>lambdaviz.cfg</code> system property if set, otherwise
 * <code>data/cfg/&lt;computer name&gt;.properties</code>.  Anything not configured takes its default.
 */
public class EngineConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming an explicit configuration file.
   */
  public static final String CFG_FILE_PROPERTY = "lambdaviz.cfg";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Reduction strategy used when the caller doesn't pick one.  One of the
     * {@link org.lambdaviz.base.util.reducer.Strategy} names.
     */
    DEFAULT_STRATEGY("NORMAL_ORDER"),

    /**
     * Step bound used when the caller doesn't pick one.
     */
    DEFAULT_MAX_STEPS(100),

    /**
     * Whether the lexer rejects unrecognised characters (rather than dropping them).
     */
    STRICT_LEXER(false),

    /**
     * Number of identical trailing snapshots in a trace after which reduction is stopped as stagnant.
     */
    STAGNATION_WINDOW(3),

    /**
     * Whether to classify the final term of a reduction against the known combinators.
     */
    CLASSIFY_COMBINATORS(true);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties ENGINE_PROPERTIES = new Properties();
  static
  {
    String lFileName = System.getProperty(CFG_FILE_PROPERTY);

    if (lFileName == null)
    {
      // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
      String lComputerName = System.getenv("COMPUTERNAME");
      if (lComputerName == null)
      {
        lComputerName = System.getenv("HOSTNAME");
      }

      if (lComputerName != null)
      {
        lFileName = "data/cfg/" + lComputerName + ".properties";
      }
    }

    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        ENGINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No engine configuration loaded from " + lFileName + " - using defaults");
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (ENGINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all configured values.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with engine properties:");
    for (Entry<Object, Object> e : ENGINE_PROPERTIES.entrySet())
    {
      // Get the key.
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    ENGINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for restoring the default of an overridden item.
   *
   * @param xiKey - the property to reset.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    ENGINE_PROPERTIES.remove(xiKey.toString());
  }
}
