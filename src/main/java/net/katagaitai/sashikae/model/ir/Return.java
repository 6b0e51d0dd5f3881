package net.katagaitai.sashikae.model.ir;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

import java.util.List;

public class Return extends Operation {
    @Getter
    private final List<Variable> values;

    public Return(List<Variable> values) {
        super(null);
        this.values = ImmutableList.copyOf(values);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public String toString() {
        return "RETURN " + values;
    }
}
