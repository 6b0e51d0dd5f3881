package net.katagaitai.sashikae.model.ir;

import lombok.Getter;
import net.katagaitai.sashikae.model.variable.Variable;

public abstract class Operation {
    // 書き込み先。ないものはnull
    @Getter
    private final Variable lvalue;

    protected Operation(Variable lvalue) {
        this.lvalue = lvalue;
    }

    public abstract <R> R accept(OperationVisitor<R> visitor);
}
