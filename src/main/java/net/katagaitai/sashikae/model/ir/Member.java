package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Member extends Operation {
    @Getter
    private final Variable variableLeft;
    @Getter
    private final String memberName;

    public Member(Variable lvalue, Variable variableLeft, String memberName) {
        super(lvalue);
        this.variableLeft = variableLeft;
        this.memberName = memberName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " -> " + variableLeft + "." + memberName;
    }
}
