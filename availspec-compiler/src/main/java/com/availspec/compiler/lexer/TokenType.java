package com.availspec.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INTEGER_LITERAL,        // 13
    FLOATING_LITERAL,       // 10.15
    STRING_LITERAL,         // "..."

    // === 标识符 ===
    IDENTIFIER,
    WILDCARD,               // _

    // === 运算符 ===
    OPERATOR,               // 连续的运算符字符，如 * 或 >=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    COLON,          // :
    SEMICOLON,      // ;
    PERIOD,         // .
    AT,             // @
    POUND,          // #

    // === 特殊 ===
    ERROR,
    EOF;

    /**
     * 是否为数值字面量
     */
    public boolean isNumericLiteral() {
        return this == INTEGER_LITERAL || this == FLOATING_LITERAL;
    }

    /**
     * 标点的固定拼写，非标点返回 null
     */
    public String getSpelling() {
        switch (this) {
            case LPAREN:    return "(";
            case RPAREN:    return ")";
            case LBRACE:    return "{";
            case RBRACE:    return "}";
            case LBRACKET:  return "[";
            case RBRACKET:  return "]";
            case COMMA:     return ",";
            case COLON:     return ":";
            case SEMICOLON: return ";";
            case PERIOD:    return ".";
            case AT:        return "@";
            case POUND:     return "#";
            case WILDCARD:  return "_";
            default:        return null;
        }
    }
}
