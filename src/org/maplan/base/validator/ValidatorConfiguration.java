package org.maplan.base.validator;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to validator configuration.
 *
 * Values come from the classpath resource {@value #RESOURCE_NAME}, overlaid by the file named in the system property
 * {@value #FILE_PROPERTY} (if set).  Anything not configured takes its default.
 */
public class ValidatorConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Classpath resource holding the configuration.
   */
  public static final String RESOURCE_NAME = "validator.properties";

  /**
   * System property naming a configuration file that overrides the classpath resource.
   */
  public static final String FILE_PROPERTY = "maplan.config";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The number of threads checking linearizations.  1 checks them in the calling thread.
     */
    LINEARIZATION_THREADS(1),

    /**
     * ANY or ALL - see {@link LinearizationPolicy}.
     */
    LINEARIZATION_POLICY("ANY"),

    /**
     * Maximum number of linearizations to check, or -1 for no limit.
     */
    MAX_LINEARIZATIONS(-1),

    /**
     * Directory under which scratch files are written.  By default, the system temporary directory.
     */
    SCRATCH_ROOT(null),

    /**
     * Whether to skip checking that the plan checker supports the problem.
     */
    SKIP_CHECKS(false),

    /**
     * Whether a failed capability check is an error (rather than a warning).
     */
    ERROR_ON_FAILED_CHECKS(true),

    /**
     * Whether a problem that names the wrong domain is an error (rather than a warning).
     */
    STRICT_DOMAIN_NAME(false);

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

  private final Properties mProperties;

  /**
   * Load configuration from the classpath resource and the override file.
   *
   * @throws IOException if a configuration source exists but can't be read.
   */
  public ValidatorConfiguration() throws IOException
  {
    mProperties = new Properties();

    try (InputStream lPropStream = ValidatorConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        mProperties.load(lPropStream);
      }
    }

    String lFile = System.getProperty(FILE_PROPERTY);
    if (lFile != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFile))
      {
        mProperties.load(lPropStream);
      }
    }
  }

  /**
   * Use the specified configuration only.
   *
   * @param xiProperties - the configuration.
   */
  public ValidatorConfiguration(Properties xiProperties)
  {
    mProperties = new Properties();
    mProperties.putAll(xiProperties);
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public String getCfgStr(CfgItem xiKey)
  {
    return mProperties.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * @return the configured linearization policy.
   */
  public LinearizationPolicy getPolicy()
  {
    return LinearizationPolicy.valueOf(getCfgStr(CfgItem.LINEARIZATION_POLICY).trim().toUpperCase());
  }

  /**
   * Log all configuration.
   */
  public void logConfig()
  {
    LOGGER.info("Running with validator properties:");
    Set<String> lUnknown = getUnknownKeys();
    for (Entry<Object, Object> e : mProperties.entrySet())
    {
      String lKey = (String)e.getKey();
      if (lUnknown.contains(lKey))
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
      else
      {
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + CfgItem.valueOf(lKey).mDefault + ")");
      }
    }
  }

  /**
   * @return the configured keys that aren't configuration items (typically typos in the config file).
   */
  public Set<String> getUnknownKeys()
  {
    Set<String> lUnknown = new TreeSet<>();
    for (String lKey : mProperties.stringPropertyNames())
    {
      try
      {
        CfgItem.valueOf(lKey);
      }
      catch (IllegalArgumentException lEx)
      {
        lUnknown.add(lKey);
      }
    }
    return lUnknown;
  }

  /**
   * Override a configuration value.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public ValidatorConfiguration overrideCfgVal(CfgItem xiKey, String xiValue)
  {
    mProperties.setProperty(xiKey.toString(), xiValue);
    return this;
  }
}
