package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Transfer extends Operation {
    @Getter
    private final Variable destination;
    @Getter
    private final Variable callValue;

    public Transfer(Variable destination, Variable callValue) {
        super(null);
        this.destination = destination;
        this.callValue = callValue;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitTransfer(this);
    }

    @Override
    public String toString() {
        return "TRANSFER dest:" + destination + " value:" + callValue;
    }
}
