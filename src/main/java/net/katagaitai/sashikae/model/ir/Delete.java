package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Delete extends Operation {
    @Getter
    private final Variable variable;

    public Delete(Variable lvalue, Variable variable) {
        super(lvalue);
        this.variable = variable;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDelete(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = delete " + variable;
    }
}
