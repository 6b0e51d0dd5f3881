package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;
import net.katagaitai.sashikae.model.variable.Variable;

public class TypeConversion extends Operation {
    @Getter
    private final Variable variable;
    @Getter
    private final Type type;

    public TypeConversion(Variable lvalue, Variable variable, Type type) {
        super(lvalue);
        this.variable = variable;
        this.type = type;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitTypeConversion(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = CONVERT " + variable + " to " + type;
    }
}
