package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Keyword;
import com.availspec.compiler.syntax.AvailabilityArgumentListSyntax;
import com.availspec.compiler.syntax.AvailabilityClauseSyntax;
import com.availspec.compiler.syntax.SyntaxKind;
import com.availspec.compiler.syntax.TokenSyntax;

import static com.availspec.compiler.lexer.TokenType.*;

/**
 * 带括号的 availability 子句：选择文法并处理括号
 *
 * <pre>
 *     availability-condition → '#available' '(' availability-arguments ')'
 *     availability-condition → '#unavailable' '(' availability-arguments ')'
 *     available-attribute    → '@available' '(' availability-arguments ')'
 *     available-attribute    → '@available' '(' platform-name ',' labeled-arguments ')'
 * </pre>
 */
class AvailabilityClauseParser {

    final Parser parser;

    AvailabilityClauseParser(Parser parser) {
        this.parser = parser;
    }

    AvailabilityClauseSyntax parseAvailabilityClause() {
        if (parser.at(AT)) {
            return parseAvailableAttribute();
        }
        return parseAvailabilityCondition();
    }

    private AvailabilityClauseSyntax parseAvailabilityCondition() {
        TokenSyntax pound = parser.at(POUND) ? parser.consumeToken() : parser.missingToken(POUND);
        TokenSyntax name;
        if (parser.at(Keyword.AVAILABLE) || parser.at(Keyword.UNAVAILABLE)) {
            name = parser.consumeToken();
        } else {
            name = parser.missingToken(IDENTIFIER);
        }
        return parseParenthesized(SyntaxKind.AVAILABILITY_CONDITION, pound, name);
    }

    private AvailabilityClauseSyntax parseAvailableAttribute() {
        TokenSyntax at = parser.consumeToken();
        TokenSyntax name = parser.at(Keyword.AVAILABLE) ? parser.consumeToken() : parser.missingToken(IDENTIFIER);
        return parseParenthesized(SyntaxKind.AVAILABILITY_ATTRIBUTE, at, name);
    }

    private AvailabilityClauseSyntax parseParenthesized(SyntaxKind kind, TokenSyntax introducer, TokenSyntax name) {
        ExpectedToken leftParen = parser.expect(LPAREN);

        AvailabilityArgumentListSyntax arguments;
        if (kind == SyntaxKind.AVAILABILITY_ATTRIBUTE && usesExtendedForm()) {
            arguments = parser.parseExtendedAvailabilitySpecList();
        } else {
            arguments = parser.parseAvailabilitySpecList();
        }

        ExpectedToken rightParen = parser.expect(RPAREN);
        return AvailabilityClauseSyntax.create(parser.arena, kind,
                introducer, name,
                leftParen.getUnexpectedBefore(), leftParen.getToken(),
                arguments,
                rightParen.getUnexpectedBefore(), rightParen.getToken());
    }

    /**
     * 属性形式以单独的平台名开头、紧跟逗号：{@code @available(iOS, introduced: 13)}、{@code @available(*, unavailable)}
     */
    private boolean usesExtendedForm() {
        return !parser.isAtEnd() && parser.peek().is(COMMA);
    }
}
