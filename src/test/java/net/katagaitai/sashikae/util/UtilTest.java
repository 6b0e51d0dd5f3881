package net.katagaitai.sashikae.util;

import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class UtilTest {

    @Test
    public void test_removeHexPrefix() throws Exception {
        assertEquals("12", Util.removeHexPrefix("0x12"));
        assertEquals("12", Util.removeHexPrefix("12"));
    }

    @Test
    public void test_isHex() throws Exception {
        assertTrue(Util.isHex("0xdeadBEEF"));
        assertFalse(Util.isHex("0x"));
        assertFalse(Util.isHex("deadbeef"));
        assertFalse(Util.isHex("0xg1"));
        assertFalse(Util.isHex(null));
    }

    @Test
    public void test_isBytes32Hex() throws Exception {
        assertTrue(Util.isBytes32Hex("0x360894a13ba1a3210667c828492db98dca3e2076cc3735a920a3ca505d382bbc"));
        assertFalse(Util.isBytes32Hex("0x360894a13ba1a3210667c828492db98dca3e2076cc3735a920a3ca505d382bb"));
        assertFalse(Util.isBytes32Hex("0X360894a13ba1a3210667c828492db98dca3e2076cc3735a920a3ca505d382bbc"));
    }

    @Test
    public void test_hexToBigInteger() throws Exception {
        assertEquals(BigInteger.valueOf(255), Util.hexToBigInteger("0xff"));
    }
}
