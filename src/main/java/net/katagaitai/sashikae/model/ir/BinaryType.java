package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum BinaryType {
    POWER("**"),
    MULTIPLICATION("*"),
    DIVISION("/"),
    MODULO("%"),
    ADDITION("+"),
    SUBTRACTION("-"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    AND("&"),
    CARET("^"),
    OR("|"),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    ANDAND("&&"),
    OROR("||");

    @Getter
    private final String symbol;

    @Override
    public String toString() {
        return symbol;
    }
}
