package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Keyword;
import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenType;

/**
 * lookahead 分类得到的消费凭据：记录分类时匹配的 token 形态，交给 {@link Parser#eat} 消费
 */
public final class TokenConsumptionHandle {
    private final TokenType type;
    private final Keyword keyword;

    TokenConsumptionHandle(TokenType type, Keyword keyword) {
        this.type = type;
        this.keyword = keyword;
    }

    boolean matches(Token token) {
        return keyword != null ? token.is(keyword) : token.is(type);
    }

    @Override
    public String toString() {
        return keyword != null ? keyword.getText() : type.name();
    }
}
