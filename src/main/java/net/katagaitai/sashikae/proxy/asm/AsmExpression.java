package net.katagaitai.sashikae.proxy.asm;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@EqualsAndHashCode
public class AsmExpression {
    public enum Kind {
        CALL, IDENTIFIER, HEX, NUMBER
    }

    @Getter
    private final Kind kind;
    // CALLなら関数名
    @Getter
    private final String text;
    @Getter
    private final List<AsmExpression> arguments;

    private AsmExpression(Kind kind, String text, List<AsmExpression> arguments) {
        this.kind = kind;
        this.text = text;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public static AsmExpression call(String name, List<AsmExpression> arguments) {
        return new AsmExpression(Kind.CALL, name, arguments);
    }

    public static AsmExpression identifier(String name) {
        return new AsmExpression(Kind.IDENTIFIER, name, ImmutableList.of());
    }

    public static AsmExpression hex(String value) {
        return new AsmExpression(Kind.HEX, value, ImmutableList.of());
    }

    public static AsmExpression number(String value) {
        return new AsmExpression(Kind.NUMBER, value, ImmutableList.of());
    }

    public boolean isCall(String name) {
        return kind == Kind.CALL && text.equals(name);
    }

    @Override
    public String toString() {
        if (kind != Kind.CALL) {
            return text;
        }
        return text + "(" + arguments.stream().map(AsmExpression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
