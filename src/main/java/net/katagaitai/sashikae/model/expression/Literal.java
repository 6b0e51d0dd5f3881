package net.katagaitai.sashikae.model.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import net.katagaitai.sashikae.model.type.Type;

@RequiredArgsConstructor
public class Literal extends Expression {
    @Getter
    private final String value;
    @Getter
    private final Type type;

    @Override
    public String toString() {
        return value;
    }
}
