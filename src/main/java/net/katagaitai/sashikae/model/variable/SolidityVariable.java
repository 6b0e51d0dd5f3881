package net.katagaitai.sashikae.model.variable;

import net.katagaitai.sashikae.model.type.Type;

public class SolidityVariable extends Variable {
    public SolidityVariable(String name, Type type) {
        super(name, type);
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitSolidityVariable(this);
    }
}
