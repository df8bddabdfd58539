package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Keyword;
import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.syntax.AvailabilityArgumentListSyntax;
import com.availspec.compiler.syntax.AvailabilityArgumentSyntax;
import com.availspec.compiler.syntax.AvailabilityConstraintSyntax;
import com.availspec.compiler.syntax.AvailabilityLabeledArgumentSyntax;
import com.availspec.compiler.syntax.Syntax;
import com.availspec.compiler.syntax.TokenListSyntax;
import com.availspec.compiler.syntax.TokenSyntax;
import com.availspec.compiler.syntax.VersionTupleSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.availspec.compiler.lexer.TokenType.*;

/**
 * availability 参数列表解析：条件形式与属性形式两套文法，共用版本解析和按原样收集的恢复逻辑
 */
class AvailabilityParser {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityParser.class);

    final Parser parser;

    AvailabilityParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 条件形式 ============

    /**
     * 解析条件形式的参数列表
     *
     * <pre>
     *     availability-arguments → availability-argument | availability-argument , availability-arguments
     * </pre>
     */
    AvailabilityArgumentListSyntax parseAvailabilitySpecList() {
        List<AvailabilityArgumentSyntax> elements = new ArrayList<AvailabilityArgumentSyntax>();
        TokenSyntax keepGoing;
        LoopProgressCondition progress = new LoopProgressCondition();
        do {
            Syntax entry;
            if (atPlainIdentifier()) {
                entry = parseAvailabilityMacro();
            } else if (parser.atAny(Parser.RECOVERY_STOPS) || canStartArgument()) {
                entry = parseAvailabilitySpec();
            } else {
                logRecovery("Unparsable availability argument", parser.currentToken());
                entry = consumeUntilRecoveryStop(null);
            }

            keepGoing = parser.consumeIf(COMMA);
            elements.add(AvailabilityArgumentSyntax.create(parser.arena, entry, keepGoing));

            // 继续之前检查下一个参数是否误用了属性形式的带标签写法
            if (keepGoing != null) {
                AvailabilityArgumentKind.Match match = parser.classifyArgument();
                if (match != null) {
                    logRecovery("Labeled argument in condition-style list", parser.currentToken());
                    TokenListSyntax tokens = consumeUntilRecoveryStop(parser.eat(match.getHandle()));
                    keepGoing = parser.consumeIf(COMMA);
                    elements.add(AvailabilityArgumentSyntax.create(parser.arena, tokens, keepGoing));
                }
            }
        } while (keepGoing != null && progress.evaluate(parser));

        return AvailabilityArgumentListSyntax.create(parser.arena, elements);
    }

    /**
     * 解析单个条件形式参数
     *
     * <pre>
     *     availability-argument → platform-name platform-version
     *     availability-argument → *
     * </pre>
     */
    Syntax parseAvailabilitySpec() {
        TokenSyntax star = parser.consumeIfContextualPunctuator("*");
        if (star != null) {
            return star;
        }

        if (parser.atAny(IDENTIFIER, WILDCARD) && atPlatformAgnosticKeyword()) {
            return parsePlatformAgnosticVersionConstraintSpec();
        }

        return parsePlatformVersionConstraintSpec();
    }

    /**
     * 平台无关的版本约束：{@code swift 5.9}、{@code _PackageDescription 5.7}
     */
    AvailabilityConstraintSyntax parsePlatformAgnosticVersionConstraintSpec() {
        ExpectedToken platform = parser.expectAny(IDENTIFIER, IDENTIFIER, WILDCARD);
        VersionTupleSyntax version = parser.parseVersionTuple();
        return AvailabilityConstraintSyntax.create(parser.arena,
                platform.getUnexpectedBefore(), platform.getToken(), version);
    }

    /**
     * 平台相关的版本约束。任何标识符都被接受为平台名，未知平台留给后续语义分析诊断。
     *
     * <pre>
     *     platform-name → iOS | iOSApplicationExtension
     *     platform-name → macOS | macOSApplicationExtension
     *     platform-name → macCatalyst | macCatalystApplicationExtension
     *     platform-name → watchOS
     *     platform-name → tvOS
     * </pre>
     */
    AvailabilityConstraintSyntax parsePlatformVersionConstraintSpec() {
        ExpectedToken platform = parser.expect(IDENTIFIER);
        VersionTupleSyntax version = parser.parseVersionTuple();
        return AvailabilityConstraintSyntax.create(parser.arena,
                platform.getUnexpectedBefore(), platform.getToken(), version);
    }

    /**
     * availability 宏不属于语言本身的文法，宏名不受关键词限制，版本可选
     *
     * <pre>
     *     availability-argument → macro-name platform-version?
     * </pre>
     */
    AvailabilityConstraintSyntax parseAvailabilityMacro() {
        TokenSyntax name = parser.consumeAnyToken(IDENTIFIER);

        VersionTupleSyntax version = null;
        if (parser.currentToken().getType().isNumericLiteral()) {
            version = parser.parseVersionTuple();
        }

        return AvailabilityConstraintSyntax.create(parser.arena, null, name, version);
    }

    // ============ 属性形式 ============

    /**
     * 解析属性形式的参数列表。第一个元素总是平台名，不做分类。
     */
    AvailabilityArgumentListSyntax parseExtendedAvailabilitySpecList() {
        List<AvailabilityArgumentSyntax> elements = new ArrayList<AvailabilityArgumentSyntax>();

        TokenSyntax platform = parser.consumeAnyToken(IDENTIFIER);
        TokenSyntax keepGoing = parser.consumeIf(COMMA);
        elements.add(AvailabilityArgumentSyntax.create(parser.arena, platform, keepGoing));

        LoopProgressCondition progress = new LoopProgressCondition();
        while (keepGoing != null && progress.evaluate(parser)) {
            Syntax entry;
            AvailabilityArgumentKind.Match match = parser.classifyArgument();
            if (match == null) {
                // 不认识的标签：原样收集到下一个分隔处
                logRecovery("Unknown availability argument", parser.currentToken());
                entry = consumeUntilRecoveryStop(null);
            } else {
                switch (match.getKind()) {
                    case MESSAGE:
                    case RENAMED:
                        entry = parseStringArgument(match);
                        break;
                    case INTRODUCED:
                    case OBSOLETED:
                        entry = parseVersionArgument(match);
                        break;
                    case DEPRECATED:
                        entry = parseDeprecatedArgument(match);
                        break;
                    case UNAVAILABLE:
                    case NOASYNC:
                        // 这两个标签从不带值
                        entry = parser.eat(match.getHandle());
                        break;
                    default:
                        throw new IllegalStateException("Unhandled argument kind: " + match.getKind());
                }
            }

            keepGoing = parser.consumeIf(COMMA);
            elements.add(AvailabilityArgumentSyntax.create(parser.arena, entry, keepGoing));
        }

        return AvailabilityArgumentListSyntax.create(parser.arena, elements);
    }

    private AvailabilityLabeledArgumentSyntax parseStringArgument(AvailabilityArgumentKind.Match match) {
        TokenSyntax label = parser.eat(match.getHandle());
        ExpectedToken colon = parser.expect(COLON);
        // 不检查是否为无插值的字符串字面量，交给后续阶段
        TokenSyntax value;
        if (parser.at(STRING_LITERAL) || !parser.atAny(Parser.RECOVERY_STOPS)) {
            value = parser.consumeToken();
        } else {
            value = parser.missingToken(STRING_LITERAL);
        }
        return AvailabilityLabeledArgumentSyntax.create(parser.arena,
                label, colon.getUnexpectedBefore(), colon.getToken(), value);
    }

    private AvailabilityLabeledArgumentSyntax parseVersionArgument(AvailabilityArgumentKind.Match match) {
        TokenSyntax label = parser.eat(match.getHandle());
        ExpectedToken colon = parser.expect(COLON);
        VersionTupleSyntax version = parser.parseVersionTuple();
        return AvailabilityLabeledArgumentSyntax.create(parser.arena,
                label, colon.getUnexpectedBefore(), colon.getToken(), version);
    }

    /**
     * {@code deprecated} 可以单独出现，也可以带版本：{@code deprecated: 10.12}
     */
    private Syntax parseDeprecatedArgument(AvailabilityArgumentKind.Match match) {
        TokenSyntax label = parser.eat(match.getHandle());
        TokenSyntax colon = parser.consumeIf(COLON);
        if (colon == null) {
            return label;
        }
        VersionTupleSyntax version = parser.parseVersionTuple();
        return AvailabilityLabeledArgumentSyntax.create(parser.arena, label, null, colon, version);
    }

    // ============ 共用的恢复逻辑 ============

    /**
     * 把 token 原样收集到下一个 ',' ')' 或 EOF 之前（不含）
     *
     * @param first 已消费的首个 token，可为 null
     */
    private TokenListSyntax consumeUntilRecoveryStop(TokenSyntax first) {
        List<TokenSyntax> tokens = new ArrayList<TokenSyntax>();
        if (first != null) {
            tokens.add(first);
        }
        LoopProgressCondition progress = new LoopProgressCondition();
        while (!parser.atAny(Parser.RECOVERY_STOPS) && progress.evaluate(parser)) {
            tokens.add(parser.consumeToken());
        }
        return TokenListSyntax.create(parser.arena, tokens);
    }

    /**
     * 普通标识符：平台名或宏名，不包括平台无关的版本标记
     */
    private boolean atPlainIdentifier() {
        return parser.at(IDENTIFIER) && !atPlatformAgnosticKeyword();
    }

    private boolean atPlatformAgnosticKeyword() {
        return parser.at(Keyword.SWIFT) || parser.at(Keyword.PACKAGE_DESCRIPTION);
    }

    /**
     * 当前 token 能否开始一个条件形式参数（允许平台名缺失而直接给出版本）
     */
    private boolean canStartArgument() {
        Token token = parser.currentToken();
        return token.isOneOf(IDENTIFIER, WILDCARD) || token.getType().isNumericLiteral() || token.isOperator("*");
    }

    private void logRecovery(String what, Token token) {
        if (log.isDebugEnabled()) {
            log.debug("{} at {}:{}:{}: '{}'", what, parser.getFileName(), token.getLine(), token.getColumn(),
                    token.getText());
        }
    }
}
