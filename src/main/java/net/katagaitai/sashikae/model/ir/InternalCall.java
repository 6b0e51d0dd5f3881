package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;
import net.katagaitai.sashikae.model.variable.Variable;

public class InternalCall extends Operation {
    @Getter
    private final String functionName;
    // 戻り値の型。戻り値がなければnull
    @Getter
    private final Type typeCall;

    public InternalCall(Variable lvalue, String functionName, Type typeCall) {
        super(lvalue);
        this.functionName = functionName;
        this.typeCall = typeCall;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitInternalCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = INTERNAL_CALL " + functionName;
    }
}
