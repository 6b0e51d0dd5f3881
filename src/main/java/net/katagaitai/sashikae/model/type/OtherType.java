package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class OtherType extends Type {
    @Getter
    private final String text;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitOther(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
