package net.katagaitai.sashikae.model.type;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@EqualsAndHashCode(callSuper = false)
public class TupleType extends Type {
    @Getter
    private final List<Type> types;

    public TupleType(List<Type> types) {
        this.types = ImmutableList.copyOf(types);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
        return "tuple(" + types.stream().map(Type::toString).collect(Collectors.joining(",")) + ")";
    }
}
