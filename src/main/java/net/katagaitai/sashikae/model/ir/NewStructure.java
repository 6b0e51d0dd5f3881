package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class NewStructure extends Operation {
    @Getter
    private final String structureName;

    public NewStructure(Variable lvalue, String structureName) {
        super(lvalue);
        this.structureName = structureName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitNewStructure(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = new " + structureName;
    }
}
