package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class UnsupportedOperation extends Operation {
    @Getter
    private final String kind;

    public UnsupportedOperation(Variable lvalue, String kind) {
        super(lvalue);
        this.kind = kind;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = UNSUPPORTED " + kind;
    }
}
