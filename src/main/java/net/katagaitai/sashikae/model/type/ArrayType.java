package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode(callSuper = false)
public class ArrayType extends Type {
    @Getter
    private final Type type;
    // 動的配列ならnull
    @Getter
    private final Integer length;

    public ArrayType(Type type) {
        this(type, null);
    }

    public ArrayType(Type type, Integer length) {
        this.type = type;
        this.length = length;
    }

    public boolean isDynamic() {
        return length == null;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String toString() {
        return type + "[" + (length == null ? "" : length) + "]";
    }
}
