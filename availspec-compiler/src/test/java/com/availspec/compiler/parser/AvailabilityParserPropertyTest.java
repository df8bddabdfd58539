package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Lexer;
import com.availspec.compiler.lexer.ListTokenSource;
import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenType;
import com.availspec.compiler.syntax.Syntax;
import com.availspec.compiler.syntax.TokenSyntax;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * 任意 token 流上的终止性与无损性
 */
class AvailabilityParserPropertyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Property(tries = 500)
    void conditionStyleTerminatesAndKeepsEveryToken(@ForAll("tokenStreams") List<Token> tokens) {
        check(tokens, Parser::parseAvailabilitySpecList);
    }

    @Property(tries = 500)
    void attributeStyleTerminatesAndKeepsEveryToken(@ForAll("tokenStreams") List<Token> tokens) {
        ListTokenSource source = check(tokens, Parser::parseExtendedAvailabilitySpecList);
        if (!source.getTokens().get(0).is(TokenType.EOF)) {
            Parser parser = new Parser(new ListTokenSource(tokens));
            parser.parseExtendedAvailabilitySpecList();
            assertThat(parser.position()).isGreaterThanOrEqualTo(1);
        }
    }

    @Property(tries = 500)
    void clauseTerminatesAndKeepsEveryToken(@ForAll("tokenStreams") List<Token> tokens) {
        check(tokens, Parser::parseAvailabilityClause);
    }

    @Property(tries = 300)
    void lexerIsLossless(@ForAll("sources") String source) {
        PrintStream discard = new PrintStream(OutputStream.nullOutputStream());
        StringBuilder rebuilt = new StringBuilder();
        for (Token token : new Lexer(source, "<prop>", discard).scanTokens()) {
            rebuilt.append(token.getFullText());
        }
        assertThat(rebuilt.toString()).isEqualTo(source);
    }

    /**
     * 解析必须在限时内结束；树中出现的真实 token 恰好是被消费的前缀，顺序一致
     */
    private ListTokenSource check(List<Token> tokens, Function<Parser, ? extends Syntax> entry) {
        ListTokenSource source = new ListTokenSource(tokens);
        Parser parser = new Parser(source);
        Syntax root = assertTimeoutPreemptively(TIMEOUT, () -> entry.apply(parser));

        List<Token> all = source.getTokens();
        assertThat(parser.position()).isLessThan(all.size());

        List<Token> present = new ArrayList<Token>();
        for (TokenSyntax token : root.getTokens()) {
            if (token.isPresent()) {
                present.add(token.getToken());
            }
        }
        assertThat(present).containsExactlyElementsOf(all.subList(0, parser.position()));

        StringBuilder consumedText = new StringBuilder();
        for (Token token : all.subList(0, parser.position())) {
            consumedText.append(token.getFullText());
        }
        assertThat(root.getSourceText()).isEqualTo(consumedText.toString());
        return source;
    }

    @Provide
    Arbitrary<List<Token>> tokenStreams() {
        Arbitrary<Token> token = Arbitraries.of(TokenType.values())
                .flatMap(type -> textFor(type).map(text -> new Token(type, text, " ", "", null, 1, 1, 0)));
        return token.list().ofMaxSize(24);
    }

    @Provide
    Arbitrary<String> sources() {
        return Arbitraries.strings()
                .withChars("iOSmacOS_13.,:()*#@\"\\/ \n\t$e+-")
                .ofMaxLength(48);
    }

    private static Arbitrary<String> textFor(TokenType type) {
        switch (type) {
            case IDENTIFIER:
                return Arbitraries.of("iOS", "macOS", "swift", "_PackageDescription", "available",
                        "message", "renamed", "introduced", "deprecated", "obsoleted", "unavailable",
                        "noasync", "bogus");
            case INTEGER_LITERAL:
                return Arbitraries.of("1", "13");
            case FLOATING_LITERAL:
                return Arbitraries.of("1.0", "10.15");
            case STRING_LITERAL:
                return Arbitraries.just("\"text\"");
            case OPERATOR:
                return Arbitraries.of("*", "+", "->");
            case ERROR:
                return Arbitraries.just("$");
            case EOF:
                return Arbitraries.just("");
            default:
                return Arbitraries.just(type.getSpelling());
        }
    }
}
