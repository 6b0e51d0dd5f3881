package net.katagaitai.sashikae.util;

import com.google.common.base.CharMatcher;

import java.math.BigInteger;

public class Util {
    private static final CharMatcher HEX_DIGIT = CharMatcher.anyOf("0123456789abcdefABCDEF");

    public static String removeHexPrefix(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    public static boolean isHex(String s) {
        if (s == null || !(s.startsWith("0x") || s.startsWith("0X"))) {
            return false;
        }
        String digits = s.substring(2);
        return digits.length() > 0 && HEX_DIGIT.matchesAllOf(digits);
    }

    // 0Xは不可
    public static boolean isBytes32Hex(String s) {
        return isHex(s) && s.startsWith("0x") && s.length() == Constants.BYTES32_HEX_LENGTH;
    }

    public static BigInteger hexToBigInteger(String hex) {
        return new BigInteger(removeHexPrefix(hex), 16);
    }
}
