package org.lambdaviz.base.test;

import org.lambdaviz.base.util.config.EngineConfiguration;
import org.lambdaviz.base.util.config.EngineConfiguration.CfgItem;
import org.lambdaviz.base.util.engine.TermEngine;
import org.lambdaviz.base.util.reducer.Strategy;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class EngineConfigurationTests extends Assert
{
  @After
  public void tearDown()
  {
    for (CfgItem lItem : CfgItem.values())
    {
      EngineConfiguration.utResetCfgVal(lItem);
    }
  }

  @Test
  public void testDefaults()
  {
    assertEquals(Strategy.NORMAL_ORDER, TermEngine.getDefaultStrategy());
    assertEquals(100, TermEngine.getDefaultMaxSteps());
    assertFalse(EngineConfiguration.getCfgBool(CfgItem.STRICT_LEXER));
    assertEquals(3, EngineConfiguration.getCfgInt(CfgItem.STAGNATION_WINDOW));
  }

  @Test
  public void testOverride()
  {
    EngineConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_STRATEGY, "call-by-value");
    EngineConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_MAX_STEPS, " 7 ");

    assertEquals(Strategy.CALL_BY_VALUE, TermEngine.getDefaultStrategy());
    assertEquals(7, TermEngine.getDefaultMaxSteps());

    EngineConfiguration.utResetCfgVal(CfgItem.DEFAULT_MAX_STEPS);
    assertEquals(100, TermEngine.getDefaultMaxSteps());
  }
}
