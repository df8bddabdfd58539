package com.availspec.compiler.syntax;

/**
 * 带标签的参数：{@code message: "..."}、{@code introduced: 10.15} 等
 */
public final class AvailabilityLabeledArgumentSyntax extends Syntax {

    private static final int LABEL = 0;
    private static final int UNEXPECTED_BEFORE_COLON = 1;
    private static final int COLON = 2;
    private static final int VALUE = 3;

    /**
     * 参数值的形式
     */
    public enum ValueKind {
        STRING,
        VERSION
    }

    AvailabilityLabeledArgumentSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    /**
     * @param value 字符串值为 token 节点，版本值为 {@link VersionTupleSyntax}
     */
    public static AvailabilityLabeledArgumentSyntax create(SyntaxArena arena,
                                                           TokenSyntax label,
                                                           UnexpectedNodesSyntax unexpectedBeforeColon,
                                                           TokenSyntax colon,
                                                           Syntax value) {
        requireNonNull(label, "label");
        requireNonNull(colon, "colon");
        requireNonNull(value, "value");
        requireKind(value, "value", SyntaxKind.TOKEN, SyntaxKind.VERSION_TUPLE);
        int id = arena.record(RawSyntax.layout(SyntaxKind.LABELED_ARGUMENT,
                idOf(arena, label),
                idOf(arena, unexpectedBeforeColon),
                idOf(arena, colon),
                idOf(arena, value)));
        return new AvailabilityLabeledArgumentSyntax(arena, id);
    }

    public TokenSyntax getLabel() {
        return child(LABEL, TokenSyntax.class);
    }

    public String getLabelText() {
        return getLabel().getText();
    }

    public UnexpectedNodesSyntax getUnexpectedBeforeColon() {
        return child(UNEXPECTED_BEFORE_COLON, UnexpectedNodesSyntax.class);
    }

    public TokenSyntax getColon() {
        return child(COLON, TokenSyntax.class);
    }

    public Syntax getValue() {
        return child(VALUE, Syntax.class);
    }

    public ValueKind getValueKind() {
        return getValue().getKind() == SyntaxKind.VERSION_TUPLE ? ValueKind.VERSION : ValueKind.STRING;
    }

    /** 字符串值，值为版本时返回 null */
    public TokenSyntax getStringValue() {
        return child(VALUE, TokenSyntax.class);
    }

    /** 版本值，值为字符串时返回 null */
    public VersionTupleSyntax getVersionValue() {
        return child(VALUE, VersionTupleSyntax.class);
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitLabeledArgument(this, context);
    }
}
