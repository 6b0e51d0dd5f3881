package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;
import net.katagaitai.sashikae.model.variable.Variable;

public class Index extends Operation {
    @Getter
    private final Variable variableLeft;
    @Getter
    private final Variable variableRight;
    @Getter
    private final Type indexType;

    public Index(Variable lvalue, Variable variableLeft, Variable variableRight, Type indexType) {
        super(lvalue);
        this.variableLeft = variableLeft;
        this.variableRight = variableRight;
        this.indexType = indexType;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " -> " + variableLeft + "[" + variableRight + "]";
    }
}
