package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public class Send extends Operation {
    @Getter
    private final Variable destination;
    @Getter
    private final Variable callValue;

    public Send(Variable lvalue, Variable destination, Variable callValue) {
        super(lvalue);
        this.destination = destination;
        this.callValue = callValue;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitSend(this);
    }

    @Override
    public String toString() {
        return getLvalue() + " = SEND dest:" + destination + " value:" + callValue;
    }
}
