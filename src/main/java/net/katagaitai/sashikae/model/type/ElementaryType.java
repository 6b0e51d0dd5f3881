package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ElementaryType extends Type {
    public static final ElementaryType ADDRESS = new ElementaryType("address");
    public static final ElementaryType BOOL = new ElementaryType("bool");
    public static final ElementaryType BYTES32 = new ElementaryType("bytes32");
    public static final ElementaryType UINT256 = new ElementaryType("uint256");

    @Getter
    private final String name;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitElementary(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
