package net.katagaitai.sashikae.model.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class AssignmentOperation extends Expression {
    @Getter
    private final Expression expressionLeft;
    @Getter
    private final Expression expressionRight;

    @Override
    public String toString() {
        return expressionLeft + " = " + expressionRight;
    }
}
