package com.availspec.compiler.syntax;

/**
 * 平台（或宏名）加可选版本，如 {@code iOS 13.0}、{@code swift 5}、{@code _myMacro}
 */
public final class AvailabilityConstraintSyntax extends Syntax {

    private static final int UNEXPECTED_BEFORE_PLATFORM = 0;
    private static final int PLATFORM = 1;
    private static final int VERSION = 2;

    AvailabilityConstraintSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static AvailabilityConstraintSyntax create(SyntaxArena arena,
                                                      UnexpectedNodesSyntax unexpectedBeforePlatform,
                                                      TokenSyntax platform,
                                                      VersionTupleSyntax version) {
        requireNonNull(platform, "platform");
        int id = arena.record(RawSyntax.layout(SyntaxKind.AVAILABILITY_CONSTRAINT,
                idOf(arena, unexpectedBeforePlatform),
                idOf(arena, platform),
                idOf(arena, version)));
        return new AvailabilityConstraintSyntax(arena, id);
    }

    public UnexpectedNodesSyntax getUnexpectedBeforePlatform() {
        return child(UNEXPECTED_BEFORE_PLATFORM, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getPlatform() {
        return child(PLATFORM, TokenSyntax.class);
    }

    public String getPlatformName() {
        return getPlatform().getText();
    }

    public VersionTupleSyntax getVersion() {
        return child(VERSION, VersionTupleSyntax.class);
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitAvailabilityConstraint(this, context);
    }
}
