package com.availspec.compiler.syntax;

import com.availspec.compiler.lexer.Keyword;

/**
 * 带括号的 availability 子句：{@code #available(...)}、{@code #unavailable(...)}（条件）
 * 或 {@code @available(...)}（属性）
 */
public final class AvailabilityClauseSyntax extends Syntax {

    private static final int INTRODUCER = 0;
    private static final int NAME = 1;
    private static final int UNEXPECTED_BEFORE_LEFT_PAREN = 2;
    private static final int LEFT_PAREN = 3;
    private static final int ARGUMENTS = 4;
    private static final int UNEXPECTED_BEFORE_RIGHT_PAREN = 5;
    private static final int RIGHT_PAREN = 6;

    AvailabilityClauseSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    /**
     * @param kind {@link SyntaxKind#AVAILABILITY_CONDITION} 或 {@link SyntaxKind#AVAILABILITY_ATTRIBUTE}
     */
    public static AvailabilityClauseSyntax create(SyntaxArena arena,
                                                  SyntaxKind kind,
                                                  TokenSyntax introducer,
                                                  TokenSyntax name,
                                                  UnexpectedNodesSyntax unexpectedBeforeLeftParen,
                                                  TokenSyntax leftParen,
                                                  AvailabilityArgumentListSyntax arguments,
                                                  UnexpectedNodesSyntax unexpectedBeforeRightParen,
                                                  TokenSyntax rightParen) {
        if (kind != SyntaxKind.AVAILABILITY_CONDITION && kind != SyntaxKind.AVAILABILITY_ATTRIBUTE) {
            throw new IllegalArgumentException("Not an availability clause kind: " + kind);
        }
        requireNonNull(introducer, "introducer");
        requireNonNull(name, "name");
        requireNonNull(leftParen, "leftParen");
        requireNonNull(arguments, "arguments");
        requireNonNull(rightParen, "rightParen");
        int id = arena.record(RawSyntax.layout(kind,
                idOf(arena, introducer),
                idOf(arena, name),
                idOf(arena, unexpectedBeforeLeftParen),
                idOf(arena, leftParen),
                idOf(arena, arguments),
                idOf(arena, unexpectedBeforeRightParen),
                idOf(arena, rightParen)));
        return new AvailabilityClauseSyntax(arena, id);
    }

    public boolean isCondition() {
        return getKind() == SyntaxKind.AVAILABILITY_CONDITION;
    }

    public boolean isAttribute() {
        return getKind() == SyntaxKind.AVAILABILITY_ATTRIBUTE;
    }

    /** {@code #unavailable(...)} */
    public boolean isNegated() {
        return getName().getToken().is(Keyword.UNAVAILABLE);
    }

    /** '#' 或 '@' */
    public TokenSyntax getIntroducer() {
        return child(INTRODUCER, TokenSyntax.class);
    }

    public TokenSyntax getName() {
        return child(NAME, TokenSyntax.class);
    }

    public UnexpectedNodesSyntax getUnexpectedBeforeLeftParen() {
        return child(UNEXPECTED_BEFORE_LEFT_PAREN, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getLeftParen() {
        return child(LEFT_PAREN, TokenSyntax.class);
    }

    public AvailabilityArgumentListSyntax getArguments() {
        return child(ARGUMENTS, AvailabilityArgumentListSyntax.class);
    }

    public UnexpectedNodesSyntax getUnexpectedBeforeRightParen() {
        return child(UNEXPECTED_BEFORE_RIGHT_PAREN, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getRightParen() {
        return child(RIGHT_PAREN, TokenSyntax.class);
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitAvailabilityClause(this, context);
    }
}
