package net.katagaitai.sashikae.model.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import net.katagaitai.sashikae.model.variable.Variable;

@RequiredArgsConstructor
public class Identifier extends Expression {
    @Getter
    private final String name;
    // 組み込み関数などの場合はnull
    @Getter
    private final Variable value;

    public Identifier(Variable value) {
        this(value.getName(), value);
    }

    @Override
    public String toString() {
        return name;
    }
}
