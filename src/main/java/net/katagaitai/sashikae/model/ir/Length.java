package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Length extends Operation {
    @Getter
    private final Variable value;

    public Length(Variable lvalue, Variable value) {
        super(lvalue);
        this.value = value;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitLength(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " -> LENGTH " + value;
    }
}
