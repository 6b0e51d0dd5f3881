package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.expression.Expression;
import net.katagaitai.sashikae.model.type.Type;

public class StateVariable extends Variable {
    @Getter
    private final boolean constant;
    @Getter
    private final boolean immutable;
    // 初期化式。なければnull
    @Getter
    private final Expression expression;

    public StateVariable(String name, Type type) {
        this(name, type, false, false, null);
    }

    public StateVariable(String name, Type type, boolean constant, boolean immutable, Expression expression) {
        super(name, type);
        this.constant = constant;
        this.immutable = immutable;
        this.expression = expression;
    }

    public boolean isMutable() {
        return !constant && !immutable;
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitStateVariable(this);
    }
}
