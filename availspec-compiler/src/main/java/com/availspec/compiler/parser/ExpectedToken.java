package com.availspec.compiler.parser;

import com.availspec.compiler.syntax.TokenSyntax;
import com.availspec.compiler.syntax.UnexpectedNodesSyntax;

/**
 * {@link Parser#expect} 的结果：期望的 token（可能是 missing 占位）及其之前被跳过的 token
 */
final class ExpectedToken {
    private final UnexpectedNodesSyntax unexpectedBefore;
    private final TokenSyntax token;

    ExpectedToken(UnexpectedNodesSyntax unexpectedBefore, TokenSyntax token) {
        this.unexpectedBefore = unexpectedBefore;
        this.token = token;
    }

    /** 可能为 null */
    UnexpectedNodesSyntax getUnexpectedBefore() {
        return unexpectedBefore;
    }

    TokenSyntax getToken() {
        return token;
    }
}
