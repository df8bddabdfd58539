package com.availspec.compiler.lexer;

/**
 * 词法单元（保留前后 trivia，可无损还原源码）
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final String leadingTrivia;
    private final String trailingTrivia;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String text, String leadingTrivia, String trailingTrivia,
                 Object literal, int line, int column, int offset) {
        this.type = type;
        this.text = text;
        this.leadingTrivia = leadingTrivia != null ? leadingTrivia : "";
        this.trailingTrivia = trailingTrivia != null ? trailingTrivia : "";
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /** 无 trivia、无字面值的 token（手工构造 token 流时使用） */
    public Token(TokenType type, String text, int line, int column, int offset) {
        this(type, text, "", "", null, line, column, offset);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getLeadingTrivia() {
        return leadingTrivia;
    }

    public String getTrailingTrivia() {
        return trailingTrivia;
    }

    /** 字符串字面量的去转义内容，其余类型为 null */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** token 文本（不含 leading trivia）在源码中的偏移 */
    public int getOffset() {
        return offset;
    }

    /** 含 leading trivia 的起始偏移 */
    public int getFullStart() {
        return offset - leadingTrivia.length();
    }

    /** leading trivia + 文本 + trailing trivia */
    public String getFullText() {
        return leadingTrivia + text + trailingTrivia;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否为给定的上下文关键词（即文本匹配的标识符）
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.IDENTIFIER && keyword.getText().equals(text);
    }

    /**
     * 是否为给定文本的运算符（如 availability 中的通配 '*'）
     */
    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && operator.equals(text);
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, text, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, text, line, column);
    }
}
