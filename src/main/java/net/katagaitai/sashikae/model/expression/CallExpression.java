package net.katagaitai.sashikae.model.expression;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

public class CallExpression extends Expression {
    @Getter
    private final Expression called;
    @Getter
    private final List<Expression> arguments;

    public CallExpression(Expression called, List<Expression> arguments) {
        this.called = called;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public String toString() {
        return called + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
