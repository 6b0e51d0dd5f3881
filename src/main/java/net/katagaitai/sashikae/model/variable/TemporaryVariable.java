package net.katagaitai.sashikae.model.variable;

import net.katagaitai.sashikae.model.type.Type;

public class TemporaryVariable extends Variable {
    public TemporaryVariable(int index, Type type) {
        super("TMP_" + index, type);
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitTemporaryVariable(this);
    }
}
