package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Assignment extends Operation {
    @Getter
    private final Variable rvalue;

    public Assignment(Variable lvalue, Variable rvalue) {
        super(lvalue);
        this.rvalue = rvalue;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " := " + rvalue;
    }
}
