package net.katagaitai.sashikae.model.cfg;

public enum NodeType {
    ENTRYPOINT,
    EXPRESSION,
    RETURN,
    IF,
    VARIABLE,
    ASSEMBLY,
    IFLOOP,
    STARTLOOP,
    ENDLOOP,
    ENDIF,
    CONTINUE,
    BREAK,
    THROW,
    PLACEHOLDER,
    TRY,
    CATCH,
    OTHER_ENTRYPOINT
}
