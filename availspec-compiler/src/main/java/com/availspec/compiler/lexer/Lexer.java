package com.availspec.compiler.lexer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * availability 参数的词法分析器（保留 trivia）
 *
 * <p>trivia 归属规则：token 之后直到换行前的空格、制表符和行注释属于该 token 的 trailing trivia；
 * 其余空白、换行和注释都作为下一个 token 的 leading trivia。EOF 携带文件末尾的 leading trivia。
 * 因此按顺序拼接所有 token 的完整文本即可逐字节还原源码。</p>
 */
public class Lexer implements TokenSource {
    private final String source;
    private final String fileName;
    private final PrintStream errStream;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的扫描结果
    private TokenType pendingType;
    private Object pendingLiteral;

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后每次调用都返回 EOF。
     */
    @Override
    public Token nextToken() {
        String leading = scanLeadingTrivia();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", leading, "", null, line, column, current);
        }

        start = current;
        int tokenLine = line;
        int tokenColumn = column;
        pendingType = null;
        pendingLiteral = null;
        scanToken();

        String text = source.substring(start, current);
        String trailing = scanTrailingTrivia();
        return new Token(pendingType, text, leading, trailing, pendingLiteral, tokenLine, tokenColumn, start);
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    // === trivia ===

    private String scanLeadingTrivia() {
        int triviaStart = current;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                lineComment();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else {
                break;
            }
        }
        return source.substring(triviaStart, current);
    }

    private String scanTrailingTrivia() {
        int triviaStart = current;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                lineComment();
            } else {
                break;
            }
        }
        return source.substring(triviaStart, current);
    }

    private void lineComment() {
        // 不消费换行，换行归下一个 token 的 leading trivia
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void blockComment() {
        advance(); // /
        advance(); // *
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) {
            report("Unterminated block comment");
        }
    }

    // === token ===

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.': addToken(TokenType.PERIOD); break;
            case '@': addToken(TokenType.AT); break;
            case '#': addToken(TokenType.POUND); break;
            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.WILDCARD);
                }
                break;

            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (isOperatorChar(c)) {
                    operator();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void operator() {
        while (isOperatorChar(peek()) && !startsComment()) advance();
        addToken(TokenType.OPERATOR);
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        advanceDigits();

        // 只吃一段小数：1.0.3 -> FLOATING(1.0) PERIOD INTEGER(3)
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            advanceDigits();
            exponent();
            addToken(TokenType.FLOATING_LITERAL);
        } else if (exponent()) {
            addToken(TokenType.FLOATING_LITERAL);
        } else {
            addToken(TokenType.INTEGER_LITERAL);
        }
    }

    /** 指数部分，仅当 e/E 后确实跟着数字时才消费 */
    private boolean exponent() {
        if (peek() != 'e' && peek() != 'E') return false;
        int digitAt = current + 1;
        if (digitAt < source.length() && (source.charAt(digitAt) == '+' || source.charAt(digitAt) == '-')) {
            digitAt++;
        }
        if (digitAt >= source.length() || !isDigit(source.charAt(digitAt))) return false;
        while (current < digitAt) advance();
        advanceDigits();
        return true;
    }

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                escape(value);
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void escape(StringBuilder value) {
        char c = advance();
        switch (c) {
            case 'n': value.append('\n'); break;
            case 't': value.append('\t'); break;
            case 'r': value.append('\r'); break;
            case '0': value.append('\0'); break;
            case '\\': value.append('\\'); break;
            case '"': value.append('"'); break;
            case '\'': value.append('\''); break;
            default:
                // 插值 \( 等原样保留，此处不做检查
                value.append('\\').append(c);
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean startsComment() {
        return peek() == '/' && (peekNext() == '/' || peekNext() == '*');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isOperatorChar(char c) {
        switch (c) {
            case '+': case '-': case '*': case '/': case '%':
            case '<': case '>': case '=': case '!': case '&':
            case '|': case '^': case '~': case '?':
                return true;
            default:
                return false;
        }
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        pendingType = type;
        pendingLiteral = literal;
    }

    private void error(String message) {
        report(message);
        addToken(TokenType.ERROR, message);
    }

    private void report(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
    }
}
