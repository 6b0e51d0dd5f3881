package net.katagaitai.sashikae.model.variable;

import net.katagaitai.sashikae.model.type.Type;

public class TupleVariable extends Variable {
    public TupleVariable(int index, Type type) {
        super("TUPLE_" + index, type);
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitTupleVariable(this);
    }
}
