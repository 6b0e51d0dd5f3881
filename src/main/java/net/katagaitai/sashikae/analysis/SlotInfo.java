package net.katagaitai.sashikae.analysis;

import lombok.Value;

import java.math.BigInteger;

@Value
public class SlotInfo {
    private String name;
    private String typeString;
    // 32バイトのスロットはlongに収まらない
    private BigInteger slot;
    private int size;
    private int offset;
}
