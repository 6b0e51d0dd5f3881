package net.katagaitai.sashikae.model.ir;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.List;

public class SolidityCall extends Operation {
    @Getter
    private final String functionFullName;
    @Getter
    private final List<Variable> arguments;

    public SolidityCall(Variable lvalue, String functionFullName, List<Variable> arguments) {
        super(lvalue);
        this.functionFullName = functionFullName;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitSolidityCall(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = SOLIDITY_CALL " + functionFullName + arguments;
    }
}
