package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Binary extends Operation {
    @Getter
    private final Variable variableLeft;
    @Getter
    private final Variable variableRight;
    @Getter
    private final BinaryType type;

    public Binary(Variable lvalue, Variable variableLeft, BinaryType type, Variable variableRight) {
        super(lvalue);
        this.variableLeft = variableLeft;
        this.variableRight = variableRight;
        this.type = type;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = " + variableLeft + " " + type + " " + variableRight;
    }
}
