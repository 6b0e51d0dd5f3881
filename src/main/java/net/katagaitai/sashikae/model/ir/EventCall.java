package net.katagaitai.sashikae.model.ir;

import lombok.Getter;

public class EventCall extends Operation {
    @Getter
    private final String name;

    public EventCall(String name) {
        super(null);
        this.name = name;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitEventCall(this);
    }

    @Override
    public String toString() {
        return "EMIT " + name;
    }
}
