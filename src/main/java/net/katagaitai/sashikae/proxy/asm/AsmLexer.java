package net.katagaitai.sashikae.proxy.asm;

import com.google.common.collect.Lists;

import java.util.List;

// インラインアセンブリの1行をトークンに分ける。どんな入力でも失敗しない。
public class AsmLexer {

    public static List<AsmToken> tokenize(String line) {
        List<AsmToken> tokens = Lists.newArrayList();
        int i = 0;
        final int n = line.length();
        while (i < n) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '/' && i + 1 < n && line.charAt(i + 1) == '/') {
                // 行末までコメント
                break;
            } else if (c == '(') {
                tokens.add(new AsmToken(AsmTokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new AsmToken(AsmTokenType.RPAREN, ")"));
                i++;
            } else if (c == ',') {
                tokens.add(new AsmToken(AsmTokenType.COMMA, ","));
                i++;
            } else if (c == ':' && i + 1 < n && line.charAt(i + 1) == '=') {
                tokens.add(new AsmToken(AsmTokenType.ASSIGN, ":="));
                i += 2;
            } else if (c == '0' && i + 1 < n && (line.charAt(i + 1) == 'x' || line.charAt(i + 1) == 'X')) {
                int end = i + 2;
                while (end < n && isHexDigit(line.charAt(end))) {
                    end++;
                }
                tokens.add(new AsmToken(AsmTokenType.HEX, line.substring(i, end)));
                i = end;
            } else if (Character.isDigit(c)) {
                int end = i;
                while (end < n && Character.isDigit(line.charAt(end))) {
                    end++;
                }
                tokens.add(new AsmToken(AsmTokenType.NUMBER, line.substring(i, end)));
                i = end;
            } else if (isIdentifierStart(c)) {
                int end = i;
                while (end < n && isIdentifierPart(line.charAt(end))) {
                    end++;
                }
                tokens.add(new AsmToken(AsmTokenType.IDENTIFIER, line.substring(i, end)));
                i = end;
            } else if (c == '"') {
                int end = line.indexOf('"', i + 1);
                end = end < 0 ? n : end + 1;
                tokens.add(new AsmToken(AsmTokenType.OTHER, line.substring(i, end)));
                i = end;
            } else {
                tokens.add(new AsmToken(AsmTokenType.OTHER, String.valueOf(c)));
                i++;
            }
        }
        return tokens;
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    // Yulの識別子はドットを含められる
    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }
}
