package net.katagaitai.sashikae;

import net.katagaitai.sashikae.diff.*;
import net.katagaitai.sashikae.proxy.AssemblyMatcherTest;
import net.katagaitai.sashikae.proxy.DelegateResolverTest;
import net.katagaitai.sashikae.proxy.SlotVariableFactoryTest;
import net.katagaitai.sashikae.proxy.asm.AsmLexerTest;
import net.katagaitai.sashikae.proxy.asm.AsmParserTest;
import net.katagaitai.sashikae.report.ReportWriterTest;
import net.katagaitai.sashikae.util.UtilTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({
        TypeCategorizerTest.class,
        IrEncoderTest.class,
        FunctionComparatorTest.class,
        TaintPropagatorTest.class,
        ContractDifferTest.class,
        AsmLexerTest.class,
        AsmParserTest.class,
        SlotVariableFactoryTest.class,
        AssemblyMatcherTest.class,
        DelegateResolverTest.class,
        ReportWriterTest.class,
        UtilTest.class,
})
public class AllTests {
}
