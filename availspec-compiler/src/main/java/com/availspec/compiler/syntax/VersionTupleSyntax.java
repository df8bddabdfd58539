package com.availspec.compiler.syntax;

import com.availspec.compiler.lexer.TokenType;

/**
 * 版本元组 {@code major[.minor[.patch]]}
 *
 * <p>{@code major.minor} 由词法分析器作为一个浮点字面量给出，第三段 patch 由单独的
 * 句点和整数字面量组成。patchPeriod 与 patchVersion 要么同时存在，要么同时缺席。</p>
 */
public final class VersionTupleSyntax extends Syntax {

    private static final int UNEXPECTED_BEFORE_MAJOR_MINOR = 0;
    private static final int MAJOR_MINOR = 1;
    private static final int PATCH_PERIOD = 2;
    private static final int UNEXPECTED_BEFORE_PATCH = 3;
    private static final int PATCH_VERSION = 4;

    VersionTupleSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static VersionTupleSyntax create(SyntaxArena arena,
                                            UnexpectedNodesSyntax unexpectedBeforeMajorMinor,
                                            TokenSyntax majorMinor,
                                            TokenSyntax patchPeriod,
                                            UnexpectedNodesSyntax unexpectedBeforePatch,
                                            TokenSyntax patchVersion) {
        requireNonNull(majorMinor, "majorMinor");
        if ((patchPeriod == null) != (patchVersion == null)) {
            throw new IllegalArgumentException("patchPeriod and patchVersion must be both present or both absent");
        }
        if (patchPeriod == null && unexpectedBeforePatch != null) {
            throw new IllegalArgumentException("unexpectedBeforePatch requires a patch component");
        }
        if (patchPeriod != null && majorMinor.getTokenType() != TokenType.FLOATING_LITERAL) {
            throw new IllegalArgumentException("patch component requires a major.minor floating literal");
        }
        int id = arena.record(RawSyntax.layout(SyntaxKind.VERSION_TUPLE,
                idOf(arena, unexpectedBeforeMajorMinor),
                idOf(arena, majorMinor),
                idOf(arena, patchPeriod),
                idOf(arena, unexpectedBeforePatch),
                idOf(arena, patchVersion)));
        return new VersionTupleSyntax(arena, id);
    }

    public UnexpectedNodesSyntax getUnexpectedBeforeMajorMinor() {
        return child(UNEXPECTED_BEFORE_MAJOR_MINOR, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getMajorMinor() {
        return child(MAJOR_MINOR, TokenSyntax.class);
    }

    public TokenSyntax getPatchPeriod() {
        return child(PATCH_PERIOD, TokenSyntax.class);
    }

    public UnexpectedNodesSyntax getUnexpectedBeforePatch() {
        return child(UNEXPECTED_BEFORE_PATCH, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getPatchVersion() {
        return child(PATCH_VERSION, TokenSyntax.class);
    }

    public boolean hasPatch() {
        return getPatchPeriod() != null;
    }

    /** 主版本号；字面量缺失或无法解码时返回 null */
    public Integer getMajor() {
        TokenSyntax majorMinor = getMajorMinor();
        if (majorMinor.isMissing()) {
            return null;
        }
        String text = majorMinor.getText();
        int dot = text.indexOf('.');
        return decode(dot >= 0 ? text.substring(0, dot) : text);
    }

    /** 次版本号；仅当 majorMinor 为浮点字面量时存在 */
    public Integer getMinor() {
        TokenSyntax majorMinor = getMajorMinor();
        if (majorMinor.isMissing() || majorMinor.getTokenType() != TokenType.FLOATING_LITERAL) {
            return null;
        }
        String text = majorMinor.getText();
        int dot = text.indexOf('.');
        return dot >= 0 ? decode(text.substring(dot + 1)) : null;
    }

    public Integer getPatch() {
        TokenSyntax patch = getPatchVersion();
        if (patch == null || patch.isMissing()) {
            return null;
        }
        return decode(patch.getText());
    }

    /**
     * 十进制数字串（允许 _ 分隔）转整数；含其他字符或超出 int 范围时返回 null
     */
    private static Integer decode(String digits) {
        long value = 0;
        int count = 0;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c == '_') continue;
            if (c < '0' || c > '9') return null;
            value = value * 10 + (c - '0');
            if (value > Integer.MAX_VALUE) return null;
            count++;
        }
        return count == 0 ? null : (int) value;
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitVersionTuple(this, context);
    }
}
