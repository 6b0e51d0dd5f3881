package net.katagaitai.sashikae.proxy.asm;

public enum AsmTokenType {
    IDENTIFIER,
    HEX,
    NUMBER,
    LPAREN,
    RPAREN,
    COMMA,
    ASSIGN,
    // 文字列リテラル、波括弧など、この文法で扱わないもの
    OTHER
}
