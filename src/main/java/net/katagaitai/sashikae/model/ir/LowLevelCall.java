package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class LowLevelCall extends Operation {
    @Getter
    private final Variable destination;
    @Getter
    private final String functionName;

    public LowLevelCall(Variable lvalue, Variable destination, String functionName) {
        super(lvalue);
        this.destination = destination;
        this.functionName = functionName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitLowLevelCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = LOW_LEVEL_CALL dest:" + destination + " function:" + functionName;
    }
}
