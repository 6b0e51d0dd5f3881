package net.katagaitai.sashikae.diff;

import com.google.common.collect.Lists;
import net.katagaitai.sashikae.model.ir.*;
import net.katagaitai.sashikae.model.type.ElementaryType;
import net.katagaitai.sashikae.model.type.MappingType;
import net.katagaitai.sashikae.model.variable.*;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class IrEncoderTest {
    private final SolidityVariableComposed sender =
            new SolidityVariableComposed("msg.sender", ElementaryType.ADDRESS);

    @Test
    public void test_代入() throws Exception {
        StateVariable owner = new StateVariable("owner", ElementaryType.ADDRESS);
        Assignment ir = new Assignment(owner, sender);
        assertEquals("(state_solc_variable(address)):=(solidity_variable_composed(msg.sender))",
                IrEncoder.encodeOperation(ir));
    }

    @Test
    public void test_状態変数の名前を変えても同じ() throws Exception {
        Assignment ir1 = new Assignment(new StateVariable("owner", ElementaryType.ADDRESS), sender);
        Assignment ir2 = new Assignment(new StateVariable("admin", ElementaryType.ADDRESS), sender);
        assertEquals(IrEncoder.encodeOperation(ir1), IrEncoder.encodeOperation(ir2));
    }

    @Test
    public void test_状態変数の型が違えば異なる() throws Exception {
        Assignment ir1 = new Assignment(new StateVariable("owner", ElementaryType.ADDRESS), sender);
        Assignment ir2 = new Assignment(new StateVariable("owner", ElementaryType.BYTES32), sender);
        assertNotEquals(IrEncoder.encodeOperation(ir1), IrEncoder.encodeOperation(ir2));
    }

    @Test
    public void test_同じ命令は常に同じ文字列() throws Exception {
        Binary ir = new Binary(new TemporaryVariable(0, ElementaryType.UINT256),
                new LocalVariable("amount", ElementaryType.UINT256), BinaryType.ADDITION,
                new Constant("1", ElementaryType.UINT256));
        String first = IrEncoder.encodeOperation(ir);
        assertEquals(first, IrEncoder.encodeOperation(ir));
        assertEquals("binary(amount+1)", first);
    }

    @Test
    public void test_演算子が違えば異なる() throws Exception {
        LocalVariable a = new LocalVariable("a", ElementaryType.UINT256);
        LocalVariable b = new LocalVariable("b", ElementaryType.UINT256);
        TemporaryVariable tmp = new TemporaryVariable(0, ElementaryType.BOOL);
        assertNotEquals(
                IrEncoder.encodeOperation(new Binary(tmp, a, BinaryType.LESS, b)),
                IrEncoder.encodeOperation(new Binary(tmp, a, BinaryType.LESS_EQUAL, b)));
    }

    @Test
    public void test_インデックスは型のカテゴリだけ() throws Exception {
        MappingType balances = new MappingType(ElementaryType.ADDRESS, ElementaryType.UINT256);
        Index ir = new Index(new ReferenceVariable(1, ElementaryType.UINT256),
                new StateVariable("balances", balances), sender, ElementaryType.ADDRESS);
        assertEquals("index(address)", IrEncoder.encodeOperation(ir));
    }

    @Test
    public void test_組み込み関数の呼び出し() throws Exception {
        SolidityCall ir = new SolidityCall(null, "require(bool,string)",
                Lists.newArrayList(new TemporaryVariable(0, ElementaryType.BOOL)));
        assertEquals("solidity_call(require(bool,string))", IrEncoder.encodeOperation(ir));
    }

    @Test
    public void test_型変換() throws Exception {
        TypeConversion ir = new TypeConversion(new TemporaryVariable(2, ElementaryType.ADDRESS),
                new LocalVariable("x", ElementaryType.UINT256), ElementaryType.ADDRESS);
        assertEquals("type_conversion(address)", IrEncoder.encodeOperation(ir));
    }

    @Test
    public void test_条件() throws Exception {
        Condition ir = new Condition(new TemporaryVariable(0, ElementaryType.BOOL));
        assertEquals("condition(temporary_variable)", IrEncoder.encodeOperation(ir));
    }

    @Test
    public void test_変数の符号化() throws Exception {
        assertEquals("local_solc_variable(memory)",
                IrEncoder.encodeVariable(new LocalVariable("s", ElementaryType.UINT256, "memory", null)));
        assertEquals("local_variable_init_tuple",
                IrEncoder.encodeVariable(new LocalVariableInitFromTuple("s", ElementaryType.UINT256, "memory", 0)));
        assertEquals("reference", IrEncoder.encodeVariable(new ReferenceVariable(3, ElementaryType.UINT256)));
        assertEquals("constant(uint256)", IrEncoder.encodeVariable(new Constant("10", ElementaryType.UINT256)));
        assertEquals("solidity_variable(this)",
                IrEncoder.encodeVariable(new SolidityVariable("this", ElementaryType.ADDRESS)));
        assertEquals("none", IrEncoder.encodeVariable(null));
    }

    @Test
    public void test_一時変数と参照変数は番号を含まない() throws Exception {
        assertEquals(
                IrEncoder.encodeVariable(new TemporaryVariable(0, ElementaryType.UINT256)),
                IrEncoder.encodeVariable(new TemporaryVariable(7, ElementaryType.BOOL)));
        assertEquals(
                IrEncoder.encodeVariable(new ReferenceVariable(0, ElementaryType.UINT256)),
                IrEncoder.encodeVariable(new ReferenceVariable(7, ElementaryType.BOOL)));
    }

    @Test
    public void test_未対応の命令は種類ごとに異なる() throws Exception {
        String e1 = IrEncoder.encodeOperation(new UnsupportedOperation(null, "Nop"));
        String e2 = IrEncoder.encodeOperation(new UnsupportedOperation(null, "CodeSize"));
        assertEquals("unsupported(Nop)", e1);
        assertNotEquals(e1, e2);
        assertEquals(e1, IrEncoder.encodeOperation(new UnsupportedOperation(null, "Nop")));
    }

    @Test
    public void test_未対応の変数は種類ごとに異なる() throws Exception {
        assertNotEquals(
                IrEncoder.encodeVariable(new UnsupportedVariable("Top", "a", null)),
                IrEncoder.encodeVariable(new UnsupportedVariable("Bottom", "a", null)));
    }
}
