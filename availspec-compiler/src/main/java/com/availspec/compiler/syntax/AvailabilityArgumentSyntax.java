package com.availspec.compiler.syntax;

/**
 * 参数列表中的一个元素：载荷加可选的尾随逗号
 */
public final class AvailabilityArgumentSyntax extends Syntax {

    private static final int ENTRY = 0;
    private static final int TRAILING_COMMA = 1;

    /**
     * 载荷形式
     */
    public enum EntryKind {
        /** 单个 token：平台名、'*'、deprecated、unavailable、noasync */
        TOKEN,
        /** 平台/宏 + 可选版本 */
        CONSTRAINT,
        LABELED_ARGUMENT,
        /** 无法识别内容的原样收集 */
        TOKEN_LIST;

        static EntryKind of(SyntaxKind kind) {
            switch (kind) {
                case TOKEN: return TOKEN;
                case AVAILABILITY_CONSTRAINT: return CONSTRAINT;
                case LABELED_ARGUMENT: return LABELED_ARGUMENT;
                case TOKEN_LIST: return TOKEN_LIST;
                default:
                    throw new IllegalArgumentException("Not an availability argument entry: " + kind);
            }
        }
    }

    AvailabilityArgumentSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static AvailabilityArgumentSyntax create(SyntaxArena arena, Syntax entry, TokenSyntax trailingComma) {
        requireNonNull(entry, "entry");
        requireKind(entry, "entry", SyntaxKind.TOKEN, SyntaxKind.AVAILABILITY_CONSTRAINT,
                SyntaxKind.LABELED_ARGUMENT, SyntaxKind.TOKEN_LIST);
        int id = arena.record(RawSyntax.layout(SyntaxKind.AVAILABILITY_ARGUMENT,
                idOf(arena, entry),
                idOf(arena, trailingComma)));
        return new AvailabilityArgumentSyntax(arena, id);
    }

    public Syntax getEntry() {
        return child(ENTRY, Syntax.class);
    }

    public EntryKind getEntryKind() {
        return EntryKind.of(getEntry().getKind());
    }

    public TokenSyntax getToken() {
        return child(ENTRY, TokenSyntax.class);
    }

    public AvailabilityConstraintSyntax getConstraint() {
        return child(ENTRY, AvailabilityConstraintSyntax.class);
    }

    public AvailabilityLabeledArgumentSyntax getLabeledArgument() {
        return child(ENTRY, AvailabilityLabeledArgumentSyntax.class);
    }

    public TokenListSyntax getTokenList() {
        return child(ENTRY, TokenListSyntax.class);
    }

    public TokenSyntax getTrailingComma() {
        return child(TRAILING_COMMA, TokenSyntax.class);
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitAvailabilityArgument(this, context);
    }
}
