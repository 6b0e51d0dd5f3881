package net.katagaitai.sashikae.proxy.asm;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AsmLexerTest {

    @Test
    public void test_tokenize() throws Exception {
        List<AsmToken> tokens = AsmLexer.tokenize("let result := delegatecall(gas, _impl, 0x0, 32)");
        assertEquals(new AsmToken(AsmTokenType.IDENTIFIER, "let"), tokens.get(0));
        assertEquals(new AsmToken(AsmTokenType.IDENTIFIER, "result"), tokens.get(1));
        assertEquals(new AsmToken(AsmTokenType.ASSIGN, ":="), tokens.get(2));
        assertEquals(new AsmToken(AsmTokenType.IDENTIFIER, "delegatecall"), tokens.get(3));
        assertEquals(new AsmToken(AsmTokenType.LPAREN, "("), tokens.get(4));
        assertEquals(new AsmToken(AsmTokenType.IDENTIFIER, "_impl"), tokens.get(7));
        assertEquals(new AsmToken(AsmTokenType.HEX, "0x0"), tokens.get(9));
        assertEquals(new AsmToken(AsmTokenType.NUMBER, "32"), tokens.get(11));
        assertEquals(new AsmToken(AsmTokenType.RPAREN, ")"), tokens.get(12));
        assertEquals(13, tokens.size());
    }

    @Test
    public void test_コメントは無視する() throws Exception {
        List<AsmToken> tokens = AsmLexer.tokenize("sload(0) // sload(1)");
        assertEquals(4, tokens.size());
    }

    @Test
    public void test_ドットを含む識別子() throws Exception {
        List<AsmToken> tokens = AsmLexer.tokenize("_impl.slot");
        assertEquals(1, tokens.size());
        assertEquals("_impl.slot", tokens.get(0).getText());
    }

    @Test
    public void test_文字列リテラル() throws Exception {
        List<AsmToken> tokens = AsmLexer.tokenize("revert(\"a, b)\")");
        assertEquals(AsmTokenType.OTHER, tokens.get(2).getType());
        assertEquals("\"a, b)\"", tokens.get(2).getText());
        assertEquals(AsmTokenType.RPAREN, tokens.get(3).getType());
    }

    @Test
    public void test_空行() throws Exception {
        assertTrue(AsmLexer.tokenize("   ").isEmpty());
    }
}
