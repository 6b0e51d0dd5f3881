package net.katagaitai.sashikae.proxy.asm;

import com.google.common.collect.Lists;

import java.util.List;
import java.util.Optional;

// インラインアセンブリの1行から呼び出し式を取り出す小さな再帰下降パーサー。
// expr := IDENTIFIER "(" [expr ("," expr)*] ")" | IDENTIFIER | HEX | NUMBER
// 見つからなければempty、文法に合わなければAsmParseException
public class AsmParser {
    private final List<AsmToken> tokens;
    private int pos;

    private AsmParser(List<AsmToken> tokens, int pos) {
        this.tokens = tokens;
        this.pos = pos;
    }

    // lineの中で最初に現れるname(...)の呼び出しを返す。
    public static Optional<AsmExpression> findCall(String line, String name) throws AsmParseException {
        List<AsmToken> tokens = AsmLexer.tokenize(line);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (isIdentifier(tokens.get(i), name) && tokens.get(i + 1).getType() == AsmTokenType.LPAREN) {
                return Optional.of(new AsmParser(tokens, i).parseExpression());
            }
        }
        return Optional.empty();
    }

    // lineが "target := callee(...)" の形なら、右辺の呼び出しを返す。
    public static Optional<AsmExpression> findAssignedCall(String line, String target, String callee)
            throws AsmParseException {
        List<AsmToken> tokens = AsmLexer.tokenize(line);
        for (int i = 0; i + 3 < tokens.size(); i++) {
            if (isIdentifier(tokens.get(i), target)
                    && tokens.get(i + 1).getType() == AsmTokenType.ASSIGN
                    && isIdentifier(tokens.get(i + 2), callee)
                    && tokens.get(i + 3).getType() == AsmTokenType.LPAREN) {
                return Optional.of(new AsmParser(tokens, i + 2).parseExpression());
            }
        }
        return Optional.empty();
    }

    private static boolean isIdentifier(AsmToken token, String name) {
        return token.getType() == AsmTokenType.IDENTIFIER && token.getText().equals(name);
    }

    private AsmExpression parseExpression() throws AsmParseException {
        AsmToken token = next();
        switch (token.getType()) {
            case HEX:
                return AsmExpression.hex(token.getText());
            case NUMBER:
                return AsmExpression.number(token.getText());
            case IDENTIFIER:
                if (peekType() == AsmTokenType.LPAREN) {
                    pos++;
                    return AsmExpression.call(token.getText(), parseArguments());
                }
                return AsmExpression.identifier(token.getText());
            default:
                throw new AsmParseException("不正なトークン: " + token);
        }
    }

    private List<AsmExpression> parseArguments() throws AsmParseException {
        List<AsmExpression> arguments = Lists.newArrayList();
        if (peekType() == AsmTokenType.RPAREN) {
            pos++;
            return arguments;
        }
        while (true) {
            arguments.add(parseExpression());
            AsmToken token = next();
            if (token.getType() == AsmTokenType.RPAREN) {
                return arguments;
            }
            if (token.getType() != AsmTokenType.COMMA) {
                throw new AsmParseException("カンマか閉じ括弧が必要: " + token);
            }
        }
    }

    private AsmToken next() throws AsmParseException {
        if (pos >= tokens.size()) {
            throw new AsmParseException("予期しない行末");
        }
        return tokens.get(pos++);
    }

    private AsmTokenType peekType() {
        return pos < tokens.size() ? tokens.get(pos).getType() : null;
    }
}
