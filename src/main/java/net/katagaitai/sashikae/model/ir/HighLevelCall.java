package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class HighLevelCall extends Operation {
    @Getter
    private final Variable destination;
    @Getter
    private final String functionName;

    public HighLevelCall(Variable lvalue, Variable destination, String functionName) {
        super(lvalue);
        this.destination = destination;
        this.functionName = functionName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitHighLevelCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = HIGH_LEVEL_CALL dest:" + destination + " function:" + functionName;
    }
}
