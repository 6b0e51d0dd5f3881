package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;
import net.katagaitai.sashikae.model.variable.Variable;

public class NewElementaryType extends Operation {
    @Getter
    private final Type type;

    public NewElementaryType(Variable lvalue, Type type) {
        super(lvalue);
        this.type = type;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitNewElementaryType(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = new " + type;
    }
}
