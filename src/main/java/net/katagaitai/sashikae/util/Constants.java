package net.katagaitai.sashikae.util;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class Constants {
    // 0x + 64桁
    public static final int BYTES32_HEX_LENGTH = 66;
    public static final int ADDRESS_BIT_SIZE = 160;
    public static final String ADDRESS_TYPE = "address";
    public static final String BYTES32_TYPE = "bytes32";

    public static final String DELEGATECALL = "delegatecall";
    public static final String SLOAD = "sload";

    // フロントエンドが生成する関数の接頭辞
    public static final String SYNTHETIC_FUNCTION_PREFIX = "slither";
    public static final String CONSTRUCTOR_VARIABLES_PREFIX = "slitherConstructor";
    // アセンブリ内で別名やスロットを表す変数名の接尾辞
    public static final List<String> ASM_NAME_SUFFIXES = ImmutableList.of("_fallback_asm", "_slot");

    public static String RESULT_DIRECTORY = "result";
}
