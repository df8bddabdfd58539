package com.availspec.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    /** 扫描源码，捕获错误输出 */
    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "<test>", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    /** 拼接所有 token 的完整文本 */
    private String reconstruct(String source) {
        StringBuilder sb = new StringBuilder();
        for (Token token : scan(source)) {
            sb.append(token.getFullText());
        }
        return sb.toString();
    }

    /** 断言单个 token 的类型 */
    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    // ================================================================
    // 标点与运算符
    // ================================================================

    @Nested
    @DisplayName("标点与运算符")
    class PunctuationTests {

        @Test
        @DisplayName("括号类 token")
        void testBrackets() {
            assertSingleToken("(", TokenType.LPAREN);
            assertSingleToken(")", TokenType.RPAREN);
            assertSingleToken("{", TokenType.LBRACE);
            assertSingleToken("}", TokenType.RBRACE);
            assertSingleToken("[", TokenType.LBRACKET);
            assertSingleToken("]", TokenType.RBRACKET);
        }

        @Test
        @DisplayName("分隔符 token")
        void testDelimiters() {
            assertSingleToken(",", TokenType.COMMA);
            assertSingleToken(":", TokenType.COLON);
            assertSingleToken(";", TokenType.SEMICOLON);
            assertSingleToken(".", TokenType.PERIOD);
            assertSingleToken("@", TokenType.AT);
            assertSingleToken("#", TokenType.POUND);
        }

        @Test
        @DisplayName("_ 单独出现为通配符")
        void testWildcard() {
            assertSingleToken("_", TokenType.WILDCARD);
            assertSingleToken("_PackageDescription", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("'*' 为运算符且不吞掉后面的右括号")
        void testStarOperator() {
            List<Token> toks = tokens("*)");
            assertEquals(2, toks.size());
            assertTrue(toks.get(0).isOperator("*"));
            assertEquals(TokenType.RPAREN, toks.get(1).getType());
        }

        @Test
        @DisplayName("连续运算符字符合并为一个 token")
        void testOperatorRun() {
            List<Token> toks = tokens(">=");
            assertEquals(1, toks.size());
            assertEquals(TokenType.OPERATOR, toks.get(0).getType());
            assertEquals(">=", toks.get(0).getText());
        }
    }

    // ================================================================
    // 数字
    // ================================================================

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("整数")
        void testInteger() {
            assertSingleToken("13", TokenType.INTEGER_LITERAL);
            assertSingleToken("1_000", TokenType.INTEGER_LITERAL);
        }

        @Test
        @DisplayName("major.minor 为浮点字面量")
        void testFloating() {
            assertSingleToken("10.15", TokenType.FLOATING_LITERAL);
            assertSingleToken("1e5", TokenType.FLOATING_LITERAL);
        }

        @Test
        @DisplayName("三段版本拆为 浮点 + 句点 + 整数")
        void testThreeComponentVersion() {
            List<Token> toks = tokens("1.0.3");
            assertEquals(3, toks.size());
            assertEquals(TokenType.FLOATING_LITERAL, toks.get(0).getType());
            assertEquals("1.0", toks.get(0).getText());
            assertEquals(TokenType.PERIOD, toks.get(1).getType());
            assertEquals(TokenType.INTEGER_LITERAL, toks.get(2).getType());
            assertEquals("3", toks.get(2).getText());
        }

        @Test
        @DisplayName("e 后没有数字时不是指数")
        void testDanglingExponent() {
            List<Token> toks = tokens("13e");
            assertEquals(2, toks.size());
            assertEquals(TokenType.INTEGER_LITERAL, toks.get(0).getType());
            assertEquals(TokenType.IDENTIFIER, toks.get(1).getType());
        }

        @Test
        @DisplayName("句点后不是数字时不构成浮点")
        void testTrailingPeriod() {
            List<Token> toks = tokens("13.");
            assertEquals(2, toks.size());
            assertEquals(TokenType.INTEGER_LITERAL, toks.get(0).getType());
            assertEquals(TokenType.PERIOD, toks.get(1).getType());
        }
    }

    // ================================================================
    // 标识符与上下文关键词
    // ================================================================

    @Nested
    @DisplayName("标识符与上下文关键词")
    class IdentifierTests {

        @Test
        @DisplayName("参数标签仍是标识符，按文本匹配关键词")
        void testContextualKeyword() {
            Token token = tokens("message").get(0);
            assertEquals(TokenType.IDENTIFIER, token.getType());
            assertTrue(token.is(Keyword.MESSAGE));
            assertFalse(token.is(Keyword.RENAMED));
        }

        @Test
        @DisplayName("平台名")
        void testPlatformName() {
            Token token = tokens("macCatalystApplicationExtension").get(0);
            assertEquals(TokenType.IDENTIFIER, token.getType());
            assertEquals("macCatalystApplicationExtension", token.getText());
        }
    }

    // ================================================================
    // 字符串
    // ================================================================

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("字符串字面量保留原始文本，字面值去转义")
        void testEscapes() {
            Token token = tokens("\"say \\\"hi\\\"\"").get(0);
            assertEquals(TokenType.STRING_LITERAL, token.getType());
            assertEquals("\"say \\\"hi\\\"\"", token.getText());
            assertEquals("say \"hi\"", token.getLiteral());
        }

        @Test
        @DisplayName("插值转义原样保留")
        void testInterpolationKeptVerbatim() {
            Token token = tokens("\"a\\(b)\"").get(0);
            assertEquals("a\\(b)", token.getLiteral());
        }

        @Test
        @DisplayName("未闭合字符串产生 ERROR token 并报告")
        void testUnterminatedString() {
            List<Token> toks = tokens("\"abc\nx");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
            assertEquals("\"abc", toks.get(0).getText());
            assertEquals("\n", toks.get(1).getLeadingTrivia());
            assertTrue(scanWithErrors("\"abc").contains("Unterminated string"));
        }

        @Test
        @DisplayName("非法字符产生 ERROR token")
        void testUnexpectedCharacter() {
            assertSingleToken("$", TokenType.ERROR);
            assertTrue(scanWithErrors("$").contains("Unexpected character: $"));
        }
    }

    // ================================================================
    // trivia 与位置
    // ================================================================

    @Nested
    @DisplayName("trivia 与位置")
    class TriviaTests {

        @Test
        @DisplayName("同一行的空白和行注释归 trailing，换行归下一个 token 的 leading")
        void testTriviaOwnership() {
            List<Token> toks = tokens("  iOS // platform\n  13");
            assertEquals("  ", toks.get(0).getLeadingTrivia());
            assertEquals(" // platform", toks.get(0).getTrailingTrivia());
            assertEquals("\n  ", toks.get(1).getLeadingTrivia());
            assertEquals("", toks.get(1).getTrailingTrivia());
        }

        @Test
        @DisplayName("块注释归 leading")
        void testBlockComment() {
            Token token = tokens("/* a /* nested */ b */ iOS").get(0);
            assertEquals("/* a /* nested */ b */ ", token.getLeadingTrivia());
            assertEquals("iOS", token.getText());
        }

        @Test
        @DisplayName("EOF 携带末尾 trivia")
        void testEofTrivia() {
            List<Token> all = scan("iOS\n// end\n");
            Token eof = all.get(all.size() - 1);
            assertEquals(TokenType.EOF, eof.getType());
            assertEquals("\n// end\n", eof.getLeadingTrivia());
        }

        @Test
        @DisplayName("行列号与偏移")
        void testPosition() {
            List<Token> toks = tokens("iOS\n  13");
            Token version = toks.get(1);
            assertEquals(2, version.getLine());
            assertEquals(3, version.getColumn());
            assertEquals(6, version.getOffset());
            assertEquals(3, version.getFullStart());
        }

        @Test
        @DisplayName("拼接完整文本可逐字节还原源码")
        void testLossless() {
            String[] sources = {
                    "iOS 13, macOS 10.15, *",
                    "  iOS, introduced: 10.0.1 , message:\"x\" // tail\n",
                    "/* lead */#available( iOS 13 ,\n\t* )",
                    "\"unterminated\n  next",
                    "$ ^ ~ ?? _ _x 1e5 13e",
                    ""
            };
            for (String source : sources) {
                assertEquals(source, reconstruct(source));
            }
        }

        @Test
        @DisplayName("到达末尾后持续返回 EOF")
        void testRepeatedEof() {
            Lexer lexer = new Lexer("iOS");
            assertEquals(TokenType.IDENTIFIER, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
        }
    }
}
