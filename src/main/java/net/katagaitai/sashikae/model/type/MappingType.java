package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class MappingType extends Type {
    @Getter
    private final Type typeFrom;
    @Getter
    private final Type typeTo;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitMapping(this);
    }

    @Override
    public String toString() {
        return "mapping(" + typeFrom + " => " + typeTo + ")";
    }
}
