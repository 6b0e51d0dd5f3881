package net.katagaitai.sashikae.model.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 構造体の宣言そのもの。UserDefinedTypeで包まれていない場合に使う。
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class StructureType extends Type {
    @Getter
    private final String canonicalName;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitStructure(this);
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
