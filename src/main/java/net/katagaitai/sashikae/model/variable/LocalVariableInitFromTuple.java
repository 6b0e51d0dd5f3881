package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;

public class LocalVariableInitFromTuple extends LocalVariable {
    @Getter
    private final int tupleIndex;

    public LocalVariableInitFromTuple(String name, Type type, String location, int tupleIndex) {
        super(name, type, location, null);
        this.tupleIndex = tupleIndex;
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitLocalVariableInitFromTuple(this);
    }
}
