package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Keyword;
import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenType;

/**
 * 属性形式中可识别的参数标签（封闭集合）
 */
public enum AvailabilityArgumentKind {
    MESSAGE(Keyword.MESSAGE),
    RENAMED(Keyword.RENAMED),
    INTRODUCED(Keyword.INTRODUCED),
    DEPRECATED(Keyword.DEPRECATED),
    OBSOLETED(Keyword.OBSOLETED),
    UNAVAILABLE(Keyword.UNAVAILABLE),
    NOASYNC(Keyword.NOASYNC);

    private final Keyword keyword;

    AvailabilityArgumentKind(Keyword keyword) {
        this.keyword = keyword;
    }

    /**
     * 仅凭当前 token 分类，不消费任何 token
     *
     * @return 匹配结果，不是可识别的标签时返回 null
     */
    public static Match classify(Token token) {
        for (AvailabilityArgumentKind kind : values()) {
            if (token.is(kind.keyword)) {
                return new Match(kind, new TokenConsumptionHandle(TokenType.IDENTIFIER, kind.keyword));
            }
        }
        return null;
    }

    /**
     * 分类结果：标签种类 + 消费凭据
     */
    public static final class Match {
        private final AvailabilityArgumentKind kind;
        private final TokenConsumptionHandle handle;

        Match(AvailabilityArgumentKind kind, TokenConsumptionHandle handle) {
            this.kind = kind;
            this.handle = handle;
        }

        public AvailabilityArgumentKind getKind() {
            return kind;
        }

        public TokenConsumptionHandle getHandle() {
            return handle;
        }
    }
}
