package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Token;

/**
 * 从语法树中收集到的语法错误
 */
public final class ParseError {

    /**
     * 错误种类
     */
    public enum Kind {
        /** 缺失的 token，树中为 missing 占位 */
        MISSING_TOKEN,
        /** 语法位置上多余的 token */
        UNEXPECTED_TOKENS,
        /** 无法识别的参数，按原样收集 */
        UNKNOWN_ARGUMENT
    }

    private final String message;
    private final Kind kind;
    private final Token token;

    public ParseError(String message, Kind kind, Token token) {
        this.message = message;
        this.kind = kind;
        this.token = token;
    }

    public String getMessage() {
        return message;
    }

    public Kind getKind() {
        return kind;
    }

    /** 定位用的 token，可能为 null */
    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String toString() {
        return getLine() + ":" + getColumn() + ": " + message;
    }
}
