package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;
import net.katagaitai.sashikae.model.variable.Variable;

public class NewArray extends Operation {
    @Getter
    private final Type arrayType;

    public NewArray(Variable lvalue, Type arrayType) {
        super(lvalue);
        this.arrayType = arrayType;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitNewArray(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = new " + arrayType;
    }
}
