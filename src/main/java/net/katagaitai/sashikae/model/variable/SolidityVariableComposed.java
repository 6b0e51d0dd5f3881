package net.katagaitai.sashikae.model.variable;

import net.katagaitai.sashikae.model.type.Type;

// msg.sender, block.timestamp などのメンバー付き組み込み変数。
public class SolidityVariableComposed extends SolidityVariable {
    public SolidityVariableComposed(String name, Type type) {
        super(name, type);
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitSolidityVariableComposed(this);
    }
}
