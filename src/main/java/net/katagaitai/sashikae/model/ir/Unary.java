package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Unary extends Operation {
    @Getter
    private final Variable rvalue;
    @Getter
    private final UnaryType type;

    public Unary(Variable lvalue, UnaryType type, Variable rvalue) {
        super(lvalue);
        this.rvalue = rvalue;
        this.type = type;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = " + type + " " + rvalue;
    }
}
