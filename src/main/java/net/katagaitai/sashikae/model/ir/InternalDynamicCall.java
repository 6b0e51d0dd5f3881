package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class InternalDynamicCall extends Operation {
    @Getter
    private final Variable function;

    public InternalDynamicCall(Variable lvalue, Variable function) {
        super(lvalue);
        this.function = function;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitInternalDynamicCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = INTERNAL_DYNAMIC_CALL " + function;
    }
}
