package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Lexer;
import com.availspec.compiler.lexer.TokenType;
import com.availspec.compiler.syntax.VersionTupleSyntax;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 版本元组解析测试
 */
class VersionTupleParserTest {

    private Parser parser(String source) {
        return new Parser(new Lexer(source, "<test>"));
    }

    private VersionTupleSyntax parse(String source) {
        return parser(source).parseVersionTuple();
    }

    @Nested
    @DisplayName("合法版本")
    class WellFormed {

        @Test
        @DisplayName("单段主版本")
        void testMajorOnly() {
            VersionTupleSyntax version = parse("13");
            assertEquals(TokenType.INTEGER_LITERAL, version.getMajorMinor().getTokenType());
            assertFalse(version.hasPatch());
            assertEquals(Integer.valueOf(13), version.getMajor());
            assertNull(version.getMinor());
            assertNull(version.getPatch());
        }

        @Test
        @DisplayName("major.minor")
        void testMajorMinor() {
            VersionTupleSyntax version = parse("10.15");
            assertEquals(TokenType.FLOATING_LITERAL, version.getMajorMinor().getTokenType());
            assertFalse(version.hasPatch());
            assertEquals(Integer.valueOf(10), version.getMajor());
            assertEquals(Integer.valueOf(15), version.getMinor());
        }

        @Test
        @DisplayName("三段版本")
        void testPatch() {
            VersionTupleSyntax version = parse("1.0.3");
            assertTrue(version.hasPatch());
            assertEquals(".", version.getPatchPeriod().getText());
            assertEquals("3", version.getPatchVersion().getText());
            assertEquals(Integer.valueOf(1), version.getMajor());
            assertEquals(Integer.valueOf(0), version.getMinor());
            assertEquals(Integer.valueOf(3), version.getPatch());
            assertFalse(version.hasMissing());
            assertEquals("1.0.3", version.getSourceText());
        }

        @Test
        @DisplayName("数字分隔符不影响取值")
        void testDigitSeparators() {
            assertEquals(Integer.valueOf(10000), parse("10_000").getMajor());
        }

        @Test
        @DisplayName("整数主版本后的句点不属于版本")
        void testPeriodAfterInteger() {
            Parser parser = parser("1 .3");
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertFalse(version.hasPatch());
            assertEquals(1, parser.position());
            assertEquals(TokenType.PERIOD, parser.currentToken().getType());
        }
    }

    @Nested
    @DisplayName("错误恢复")
    class Recovery {

        @Test
        @DisplayName("句点后缺少 patch 时合成 missing 整数")
        void testMissingPatch() {
            VersionTupleSyntax version = parse("1.0.");
            assertTrue(version.hasPatch());
            assertTrue(version.getPatchVersion().isMissing());
            assertEquals(TokenType.INTEGER_LITERAL, version.getPatchVersion().getTokenType());
            assertNull(version.getPatch());
            assertTrue(version.hasMissing());
        }

        @Test
        @DisplayName("在分隔符处不消费任何 token")
        void testMissingAtComma() {
            Parser parser = parser(", iOS");
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertTrue(version.getMajorMinor().isMissing());
            assertNull(version.getMajor());
            assertEquals(0, parser.position());
            assertEquals(TokenType.COMMA, parser.currentToken().getType());
        }

        @Test
        @DisplayName("在 EOF 处合成 missing")
        void testMissingAtEof() {
            Parser parser = parser("");
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertTrue(version.getMajorMinor().isMissing());
            assertEquals(0, parser.position());
        }

        @Test
        @DisplayName("版本前的多余 token 收为 unexpected")
        void testUnexpectedBeforeVersion() {
            VersionTupleSyntax version = parse("foo 2.0");
            assertNotNull(version.getUnexpectedBeforeMajorMinor());
            assertEquals(1, version.getUnexpectedBeforeMajorMinor().getElements().size());
            assertEquals("foo", version.getUnexpectedBeforeMajorMinor().getElements().get(0).getText());
            assertEquals("2.0", version.getMajorMinor().getText());
            assertTrue(version.hasUnexpected());
            assertEquals("foo 2.0", version.getSourceText());
        }

        @Test
        @DisplayName("patch 前的多余 token 收为 unexpected")
        void testUnexpectedBeforePatch() {
            VersionTupleSyntax version = parse("1.0. beta 3");
            assertNotNull(version.getUnexpectedBeforePatch());
            assertEquals("3", version.getPatchVersion().getText());
            assertEquals(Integer.valueOf(3), version.getPatch());
        }

        @Test
        @DisplayName("向前查找不越过逗号")
        void testLookaheadStopsAtComma() {
            Parser parser = parser("foo, 2.0");
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertTrue(version.getMajorMinor().isMissing());
            assertNull(version.getUnexpectedBeforeMajorMinor());
            assertEquals(0, parser.position());
        }

        @Test
        @DisplayName("超出恢复窗口时不消费")
        void testLookaheadLimit() {
            Parser parser = parser("a b c d 2.0");
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertTrue(version.getMajorMinor().isMissing());
            assertEquals(0, parser.position());
        }

        @Test
        @DisplayName("恢复窗口可配置")
        void testConfiguredLookahead() {
            ParserConfig config = new ParserConfig();
            config.setRecoveryLookahead(4);
            Parser parser = new Parser(new Lexer("a b c d 2.0"), config);
            VersionTupleSyntax version = parser.parseVersionTuple();
            assertFalse(version.getMajorMinor().isMissing());
            assertEquals(4, version.getUnexpectedBeforeMajorMinor().getElements().size());
            assertEquals(5, parser.position());
        }

        @Test
        @DisplayName("恢复窗口为 0 时只看当前 token")
        void testZeroLookahead() {
            ParserConfig config = new ParserConfig();
            config.setRecoveryLookahead(0);
            Parser parser = new Parser(new Lexer("foo 2.0"), config);
            assertTrue(parser.parseVersionTuple().getMajorMinor().isMissing());
            assertEquals(0, parser.position());
        }

        @Test
        @DisplayName("恢复窗口不能为负数")
        void testNegativeLookahead() {
            assertThrows(IllegalArgumentException.class, () -> new ParserConfig().setRecoveryLookahead(-1));
        }
    }
}
