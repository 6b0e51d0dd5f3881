package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum UnaryType {
    BANG("!"),
    TILD("~");

    @Getter
    private final String symbol;

    @Override
    public String toString() {
        return symbol;
    }
}
