package net.katagaitai.sashikae.model.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MemberAccess extends Expression {
    @Getter
    private final Expression expression;
    @Getter
    private final String memberName;

    @Override
    public String toString() {
        return expression + "." + memberName;
    }
}
