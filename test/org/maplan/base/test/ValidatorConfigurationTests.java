package org.maplan.base.test;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.validator.LinearizationPolicy;
import org.maplan.base.validator.ValidatorConfiguration;
import org.maplan.base.validator.ValidatorConfiguration.CfgItem;

import com.google.common.collect.ImmutableSet;

public class ValidatorConfigurationTests extends Assert
{
  @Test
  public void testDefaults()
  {
    ValidatorConfiguration lConfig = new ValidatorConfiguration(new Properties());
    assertEquals(1, lConfig.getCfgInt(CfgItem.LINEARIZATION_THREADS));
    assertEquals(-1, lConfig.getCfgInt(CfgItem.MAX_LINEARIZATIONS));
    assertEquals(LinearizationPolicy.ANY, lConfig.getPolicy());
    assertNull(lConfig.getCfgStr(CfgItem.SCRATCH_ROOT));
    assertFalse(lConfig.getCfgBool(CfgItem.SKIP_CHECKS));
    assertTrue(lConfig.getCfgBool(CfgItem.ERROR_ON_FAILED_CHECKS));
    assertFalse(lConfig.getCfgBool(CfgItem.STRICT_DOMAIN_NAME));
  }

  @Test
  public void testProperties()
  {
    Properties lProperties = new Properties();
    lProperties.setProperty("LINEARIZATION_THREADS", " 4 ");
    lProperties.setProperty("LINEARIZATION_POLICY", "all");
    lProperties.setProperty("NOT_A_SETTING", "x");

    ValidatorConfiguration lConfig = new ValidatorConfiguration(lProperties);
    assertEquals(4, lConfig.getCfgInt(CfgItem.LINEARIZATION_THREADS));
    assertEquals(LinearizationPolicy.ALL, lConfig.getPolicy());
    assertEquals(ImmutableSet.of("NOT_A_SETTING"), lConfig.getUnknownKeys());
    lConfig.logConfig();

    // Later changes to the source don't leak in.
    lProperties.setProperty("LINEARIZATION_THREADS", "8");
    assertEquals(4, lConfig.getCfgInt(CfgItem.LINEARIZATION_THREADS));
  }

  @Test
  public void testNoUnknownKeysInStandardConfiguration() throws Exception
  {
    assertTrue(new ValidatorConfiguration().getUnknownKeys().isEmpty());
  }

  @Test
  public void testOverride()
  {
    ValidatorConfiguration lConfig = new ValidatorConfiguration(new Properties())
        .overrideCfgVal(CfgItem.MAX_LINEARIZATIONS, "10")
        .overrideCfgVal(CfgItem.SKIP_CHECKS, "TRUE");
    assertEquals(10, lConfig.getCfgInt(CfgItem.MAX_LINEARIZATIONS));
    assertTrue(lConfig.getCfgBool(CfgItem.SKIP_CHECKS));
  }

  @Test
  public void testClasspathResource() throws Exception
  {
    ValidatorConfiguration lConfig = new ValidatorConfiguration();
    assertEquals(LinearizationPolicy.ANY, lConfig.getPolicy());
    assertEquals(1, lConfig.getCfgInt(CfgItem.LINEARIZATION_THREADS));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadPolicy()
  {
    new ValidatorConfiguration(new Properties()).overrideCfgVal(CfgItem.LINEARIZATION_POLICY, "SOME").getPolicy();
  }
}
