package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Keyword;
import com.availspec.compiler.lexer.Lexer;
import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenSource;
import com.availspec.compiler.lexer.TokenType;
import com.availspec.compiler.syntax.AvailabilityArgumentListSyntax;
import com.availspec.compiler.syntax.AvailabilityClauseSyntax;
import com.availspec.compiler.syntax.SyntaxArena;
import com.availspec.compiler.syntax.TokenSyntax;
import com.availspec.compiler.syntax.UnexpectedNodesSyntax;
import com.availspec.compiler.syntax.VersionTupleSyntax;

import java.util.ArrayList;
import java.util.List;

import static com.availspec.compiler.lexer.TokenType.*;

/**
 * availability 语法分析器（递归下降、容错）
 *
 * <p>持有唯一的 token 游标，所有子解析器通过它读取和消费 token。解析从不抛出语法异常：
 * 缺失的 token 以 missing 占位合成，多余的 token 收进 unexpected 节点，树本身就是错误载体。
 * 游标永远不会越过 EOF。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    /** 恢复时的向前查看不会越过这些 token */
    static final TokenType[] RECOVERY_STOPS = {EOF, COMMA, RPAREN};

    final TokenSource source;
    final ParserConfig config;
    final SyntaxArena arena;
    Token current;
    private final List<Token> lookahead = new ArrayList<Token>(4); // 多 token 向前查看缓冲
    private int position;  // 已消费 token 数

    // === Helper 实例 ===
    final VersionTupleParser versionParser = new VersionTupleParser(this);
    final AvailabilityParser availabilityParser = new AvailabilityParser(this);
    final AvailabilityClauseParser clauseParser = new AvailabilityClauseParser(this);

    public Parser(Lexer lexer) {
        this(lexer, configFor(lexer));
    }

    public Parser(TokenSource source) {
        this(source, new ParserConfig());
    }

    public Parser(TokenSource source, ParserConfig config) {
        this(source, config, new SyntaxArena());
    }

    public Parser(TokenSource source, ParserConfig config, SyntaxArena arena) {
        this.source = source;
        this.config = config;
        this.arena = arena;
        this.current = source.nextToken();  // 读取第一个 token
    }

    private static ParserConfig configFor(Lexer lexer) {
        ParserConfig config = new ParserConfig();
        config.setFileName(lexer.getFileName());
        return config;
    }

    // ============ 公共入口 ============

    /**
     * 条件形式的参数列表，如 {@code iOS 13, macOS 10.15, *}
     */
    public AvailabilityArgumentListSyntax parseAvailabilitySpecList() {
        return availabilityParser.parseAvailabilitySpecList();
    }

    /**
     * 属性形式的参数列表，如 {@code iOS, introduced: 13, deprecated, message: "..."}
     */
    public AvailabilityArgumentListSyntax parseExtendedAvailabilitySpecList() {
        return availabilityParser.parseExtendedAvailabilitySpecList();
    }

    /**
     * {@code #available(...)}、{@code #unavailable(...)} 或 {@code @available(...)}
     */
    public AvailabilityClauseSyntax parseAvailabilityClause() {
        return clauseParser.parseAvailabilityClause();
    }

    public SyntaxArena getArena() {
        return arena;
    }

    public String getFileName() {
        return config.getFileName();
    }

    public Token currentToken() {
        return current;
    }

    /**
     * 游标位置：已消费的 token 数，单调不减
     */
    public int position() {
        return position;
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token。位于 EOF 时不移动。
     */
    Token advance() {
        if (current.is(EOF)) {
            return current;
        }
        Token consumed = current;
        if (!lookahead.isEmpty()) {
            current = lookahead.remove(0);
        } else {
            current = source.nextToken();
        }
        position++;
        return consumed;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return peek(1);
    }

    /**
     * 向前查看第 distance 个 token，0 为当前 token。EOF 之后总是返回 EOF。
     */
    Token peek(int distance) {
        if (distance == 0 || current.is(EOF)) {
            return current;
        }
        while (lookahead.size() < distance) {
            Token last = lookahead.isEmpty() ? current : lookahead.get(lookahead.size() - 1);
            if (last.is(EOF)) {
                return last;
            }
            lookahead.add(source.nextToken());
        }
        return lookahead.get(distance - 1);
    }

    boolean at(TokenType type) {
        return current.is(type);
    }

    boolean atAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean at(Keyword keyword) {
        return current.is(keyword);
    }

    boolean isAtEnd() {
        return at(EOF);
    }

    /**
     * 对当前 token 做参数标签分类（不消费）
     */
    AvailabilityArgumentKind.Match classifyArgument() {
        return AvailabilityArgumentKind.classify(current);
    }

    // ============ 消费与合成 ============

    /**
     * 消费当前 token 并包装为节点。调用方须保证不在 EOF。
     */
    TokenSyntax consumeToken() {
        return TokenSyntax.present(arena, advance());
    }

    /**
     * 当前 token 匹配则消费，否则返回 null
     */
    TokenSyntax consumeIf(TokenType type) {
        return at(type) ? consumeToken() : null;
    }

    /**
     * 当前 token 是给定拼写的运算符（如 '*'）则消费，否则返回 null
     */
    TokenSyntax consumeIfContextualPunctuator(String operator) {
        return current.isOperator(operator) ? consumeToken() : null;
    }

    /**
     * 无条件消费当前 token；位于 EOF 时改为合成给定类型的 missing token
     */
    TokenSyntax consumeAnyToken(TokenType placeholderType) {
        return isAtEnd() ? missingToken(placeholderType) : consumeToken();
    }

    /**
     * 按分类凭据消费当前 token
     */
    TokenSyntax eat(TokenConsumptionHandle handle) {
        if (!handle.matches(current)) {
            throw new IllegalStateException("Handle '" + handle + "' does not match current token " + current);
        }
        return consumeToken();
    }

    TokenSyntax missingToken(TokenType type) {
        return TokenSyntax.missing(arena, type, current);
    }

    ExpectedToken expect(TokenType type) {
        return expectAny(type, type);
    }

    /**
     * 期望当前 token 为给定类型之一。
     *
     * <p>不匹配时在恢复窗口内向前查找：找到则把中间的 token 收为 unexpected 再消费它；
     * 否则不消费任何 token，合成 defaultType 的 missing 占位。</p>
     */
    ExpectedToken expectAny(TokenType defaultType, TokenType... types) {
        if (atAny(types)) {
            return new ExpectedToken(null, consumeToken());
        }
        int limit = config.getRecoveryLookahead();
        for (int distance = 0; distance <= limit; distance++) {
            Token token = peek(distance);
            // 期望的就是 ')' 时也能跨过多余 token 找到它
            if (distance > 0 && token.isOneOf(types)) {
                UnexpectedNodesSyntax unexpected = consumeUnexpected(distance);
                return new ExpectedToken(unexpected, consumeToken());
            }
            if (token.isOneOf(RECOVERY_STOPS)) {
                break;
            }
        }
        return new ExpectedToken(null, missingToken(defaultType));
    }

    private UnexpectedNodesSyntax consumeUnexpected(int count) {
        List<TokenSyntax> tokens = new ArrayList<TokenSyntax>(count);
        for (int i = 0; i < count; i++) {
            tokens.add(consumeToken());
        }
        return UnexpectedNodesSyntax.create(arena, tokens);
    }

    // ============ 版本解析委托 ============

    VersionTupleSyntax parseVersionTuple() { return versionParser.parseVersionTuple(); }

}
