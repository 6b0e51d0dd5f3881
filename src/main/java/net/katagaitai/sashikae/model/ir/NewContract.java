package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class NewContract extends Operation {
    @Getter
    private final String contractName;

    public NewContract(Variable lvalue, String contractName) {
        super(lvalue);
        this.contractName = contractName;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitNewContract(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = new " + contractName;
    }
}
