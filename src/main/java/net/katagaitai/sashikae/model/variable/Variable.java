package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.type.Type;

// IRに現れる変数。同一性はインスタンスで判定する。
public abstract class Variable {
    @Getter
    private final String name;
    @Getter
    private final Type type;

    protected Variable(String name, Type type) {
        this.name = name;
        this.type = type;
    }

    public abstract <R> R accept(VariableVisitor<R> visitor);

    @Override
    public String toString() {
        return name;
    }
}
