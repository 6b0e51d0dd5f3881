package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Condition extends Operation {
    @Getter
    private final Variable value;

    public Condition(Variable value) {
        super(null);
        this.value = value;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCondition(this);
    }

    @Override
    public String toString() {
        return "CONDITION " + value;
    }
}
