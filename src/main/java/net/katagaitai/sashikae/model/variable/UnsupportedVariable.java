package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;

public class UnsupportedVariable extends Variable {
    @Getter
    private final String kind;

    public UnsupportedVariable(String kind, String name, Type type) {
        super(name, type);
        this.kind = kind;
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
