package net.katagaitai.sashikae.model.variable;

import lombok.Getter;
import net.katagaitai.sashikae.model.expression.Expression;
import net.katagaitai.sashikae.model.type.Type;

// 関数内のローカル変数。引数と名前付き戻り値もこれで表す。
public class LocalVariable extends Variable {
    public static final String LOCATION_DEFAULT = "default";

    // memory, storage, calldata, default
    @Getter
    private final String location;
    @Getter
    private final Expression expression;

    public LocalVariable(String name, Type type) {
        this(name, type, LOCATION_DEFAULT, null);
    }

    public LocalVariable(String name, Type type, String location, Expression expression) {
        super(name, type);
        this.location = location;
        this.expression = expression;
    }

    @Override
    public <R> R accept(VariableVisitor<R> visitor) {
        return visitor.visitLocalVariable(this);
    }
}
