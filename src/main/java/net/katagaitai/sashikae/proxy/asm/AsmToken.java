package net.katagaitai.sashikae.proxy.asm;

import lombok.Value;

@Value
public class AsmToken {
    private AsmTokenType type;
    private String text;

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
