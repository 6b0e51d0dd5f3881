package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Unpack extends Operation {
    @Getter
    private final Variable tuple;
    @Getter
    private final int index;

    public Unpack(Variable lvalue, Variable tuple, int index) {
        super(lvalue);
        this.tuple = tuple;
        this.index = index;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitUnpack(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = UNPACK " + tuple + " index: " + index;
    }
}
