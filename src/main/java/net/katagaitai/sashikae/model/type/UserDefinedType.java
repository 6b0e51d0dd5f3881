package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class UserDefinedType extends Type {
    public enum Kind {
        CONTRACT, STRUCTURE, ENUM
    }

    @Getter
    private final Kind kind;
    @Getter
    private final String name;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitUserDefined(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
