package com.availspec.compiler.syntax;

import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenType;

/**
 * token 叶子节点
 */
public final class TokenSyntax extends Syntax {

    TokenSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static TokenSyntax present(SyntaxArena arena, Token token) {
        return new TokenSyntax(arena, arena.record(RawSyntax.token(token, SourcePresence.PRESENT)));
    }

    /**
     * 合成缺失 token：文本为空、无 trivia，位置取自 anchor（通常是解析器当前所在的 token）
     */
    public static TokenSyntax missing(SyntaxArena arena, TokenType type, Token anchor) {
        Token placeholder = new Token(type, "", anchor.getLine(), anchor.getColumn(), anchor.getFullStart());
        return new TokenSyntax(arena, arena.record(RawSyntax.token(placeholder, SourcePresence.MISSING)));
    }

    public Token getToken() {
        return getRaw().getToken();
    }

    public TokenType getTokenType() {
        return getToken().getType();
    }

    public String getText() {
        return getToken().getText();
    }

    public SourcePresence getPresence() {
        return getRaw().getPresence();
    }

    public boolean isMissing() {
        return getPresence() == SourcePresence.MISSING;
    }

    public boolean isPresent() {
        return getPresence() == SourcePresence.PRESENT;
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitToken(this, context);
    }
}
