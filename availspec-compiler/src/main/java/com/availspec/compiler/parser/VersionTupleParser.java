package com.availspec.compiler.parser;

import com.availspec.compiler.syntax.TokenSyntax;
import com.availspec.compiler.syntax.UnexpectedNodesSyntax;
import com.availspec.compiler.syntax.VersionTupleSyntax;

import static com.availspec.compiler.lexer.TokenType.*;

/**
 * 版本元组解析
 *
 * <pre>
 *     platform-version → decimal-digits
 *     platform-version → decimal-digits '.' decimal-digits
 *     platform-version → decimal-digits '.' decimal-digits '.' decimal-digits
 * </pre>
 */
class VersionTupleParser {

    final Parser parser;

    VersionTupleParser(Parser parser) {
        this.parser = parser;
    }

    VersionTupleSyntax parseVersionTuple() {
        ExpectedToken majorMinor = parser.expectAny(INTEGER_LITERAL, INTEGER_LITERAL, FLOATING_LITERAL);

        TokenSyntax patchPeriod = null;
        UnexpectedNodesSyntax unexpectedBeforePatch = null;
        TokenSyntax patch = null;
        // 只有 major.minor 形式才可能有第三段
        if (majorMinor.getToken().getTokenType() == FLOATING_LITERAL) {
            patchPeriod = parser.consumeIf(PERIOD);
            if (patchPeriod != null) {
                ExpectedToken patchVersion = parser.expect(INTEGER_LITERAL);
                unexpectedBeforePatch = patchVersion.getUnexpectedBefore();
                patch = patchVersion.getToken();
            }
        }

        return VersionTupleSyntax.create(parser.arena,
                majorMinor.getUnexpectedBefore(),
                majorMinor.getToken(),
                patchPeriod,
                unexpectedBeforePatch,
                patch);
    }
}
