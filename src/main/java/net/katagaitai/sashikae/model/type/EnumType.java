package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class EnumType extends Type {
    @Getter
    private final String canonicalName;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
