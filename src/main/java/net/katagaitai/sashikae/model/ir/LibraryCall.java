package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class LibraryCall extends Operation {
    @Getter
    private final Variable destination;
    @Getter
    private final String functionName;

    public LibraryCall(Variable lvalue, Variable destination, String functionName) {
        super(lvalue);
        this.destination = destination;
        this.functionName = functionName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitLibraryCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = LIBRARY_CALL dest:" + destination + " function:" + functionName;
    }
}
