package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;

public class Constant extends Variable {
    @Getter
    private final String value;

    public Constant(String value, Type type) {
        super(value, type);
        this.value = value;
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
