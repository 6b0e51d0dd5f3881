package net.katagaitai.sashikae.model.variable;

import net.katagaitai.sashikae.model.type.Type;

public class ReferenceVariable extends Variable {
    public ReferenceVariable(int index, Type type) {
        super("REF_" + index, type);
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitReferenceVariable(this);
    }
}
