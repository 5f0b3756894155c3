package org.lambdaviz.base.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({BetaReducerTests.class,
                     CombinatorClassifierTests.class,
                     EngineConfigurationTests.class,
                     KnownTermTest.class,
                     StrategyTests.class,
                     SubstituterTests.class,
                     TermEngineTests.class,
                     TermFactoryTests.class,
                     TermLexerTests.class,
                     TermUtilsTests.class})
public class FastTests
{

}
