package net.katagaitai.sashikae.model.ir;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.List;

public class InitArray extends Operation {
    @Getter
    private final List<Variable> initValues;

    public InitArray(Variable lvalue, List<Variable> initValues) {
        super(lvalue);
        this.initValues = ImmutableList.copyOf(initValues);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitInitArray(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = " + initValues;
    }
}
