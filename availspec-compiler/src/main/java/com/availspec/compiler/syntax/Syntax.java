package com.availspec.compiler.syntax;

import com.availspec.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语法节点视图基类：(arena, 句柄) 上的只读包装。
 *
 * <p>视图本身不持有子节点，所有访问都经 arena 解析句柄完成；同一 arena 中的同一句柄视为同一节点。</p>
 */
public abstract class Syntax {
    protected final SyntaxArena arena;
    protected final int id;

    protected Syntax(SyntaxArena arena, int id) {
        this.arena = arena;
        this.id = id;
    }

    /**
     * 按节点种类创建对应的视图
     */
    public static Syntax wrap(SyntaxArena arena, int id) {
        RawSyntax raw = arena.get(id);
        switch (raw.getKind()) {
            case TOKEN: return new TokenSyntax(arena, id);
            case UNEXPECTED_NODES: return new UnexpectedNodesSyntax(arena, id);
            case TOKEN_LIST: return new TokenListSyntax(arena, id);
            case VERSION_TUPLE: return new VersionTupleSyntax(arena, id);
            case AVAILABILITY_CONSTRAINT: return new AvailabilityConstraintSyntax(arena, id);
            case LABELED_ARGUMENT: return new AvailabilityLabeledArgumentSyntax(arena, id);
            case AVAILABILITY_ARGUMENT: return new AvailabilityArgumentSyntax(arena, id);
            case AVAILABILITY_ARGUMENT_LIST: return new AvailabilityArgumentListSyntax(arena, id);
            case AVAILABILITY_CONDITION:
            case AVAILABILITY_ATTRIBUTE:
                return new AvailabilityClauseSyntax(arena, id);
            default:
                throw new IllegalStateException("Unhandled syntax kind: " + raw.getKind());
        }
    }

    public SyntaxArena getArena() {
        return arena;
    }

    public int getId() {
        return id;
    }

    public RawSyntax getRaw() {
        return arena.get(id);
    }

    public SyntaxKind getKind() {
        return getRaw().getKind();
    }

    public abstract <R, C> R accept(SyntaxVisitor<R, C> visitor, C context);

    /**
     * 直接子节点（跳过缺席槽位）
     */
    public List<Syntax> getChildren() {
        RawSyntax raw = getRaw();
        if (raw.getChildCount() == 0) {
            return Collections.emptyList();
        }
        List<Syntax> children = new ArrayList<Syntax>(raw.getChildCount());
        for (int i = 0; i < raw.getChildCount(); i++) {
            int child = raw.getChild(i);
            if (child != SyntaxArena.ABSENT) {
                children.add(wrap(arena, child));
            }
        }
        return children;
    }

    /**
     * 按源码顺序收集所有 token 叶子（含 missing 占位）
     */
    public List<TokenSyntax> getTokens() {
        List<TokenSyntax> tokens = new ArrayList<TokenSyntax>();
        collectTokens(id, tokens);
        return tokens;
    }

    private void collectTokens(int node, List<TokenSyntax> out) {
        RawSyntax raw = arena.get(node);
        if (raw.isToken()) {
            out.add(new TokenSyntax(arena, node));
            return;
        }
        for (int i = 0; i < raw.getChildCount(); i++) {
            int child = raw.getChild(i);
            if (child != SyntaxArena.ABSENT) {
                collectTokens(child, out);
            }
        }
    }

    /**
     * 还原该节点覆盖的源码（含 trivia，missing token 不贡献任何字符）
     */
    public String getSourceText() {
        StringBuilder sb = new StringBuilder();
        for (TokenSyntax token : getTokens()) {
            if (token.isPresent()) {
                sb.append(token.getToken().getFullText());
            }
        }
        return sb.toString();
    }

    /** 第一个真实出现的 token，全部缺失时返回 null */
    public Token getFirstPresentToken() {
        for (TokenSyntax token : getTokens()) {
            if (token.isPresent()) {
                return token.getToken();
            }
        }
        return null;
    }

    public boolean hasMissing() {
        for (TokenSyntax token : getTokens()) {
            if (token.isMissing()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasUnexpected() {
        return containsKind(id, SyntaxKind.UNEXPECTED_NODES);
    }

    private boolean containsKind(int node, SyntaxKind kind) {
        RawSyntax raw = arena.get(node);
        if (raw.getKind() == kind) {
            return true;
        }
        for (int i = 0; i < raw.getChildCount(); i++) {
            int child = raw.getChild(i);
            if (child != SyntaxArena.ABSENT && containsKind(child, kind)) {
                return true;
            }
        }
        return false;
    }

    // ============ 子类辅助 ============

    protected <T extends Syntax> T child(int slot, Class<T> type) {
        int child = getRaw().getChild(slot);
        if (child == SyntaxArena.ABSENT) {
            return null;
        }
        Syntax node = wrap(arena, child);
        return type.isInstance(node) ? type.cast(node) : null;
    }

    /**
     * 取子节点句柄；null 表示缺席。子节点必须来自同一 arena。
     */
    protected static int idOf(SyntaxArena arena, Syntax node) {
        if (node == null) {
            return SyntaxArena.ABSENT;
        }
        if (node.arena != arena) {
            throw new IllegalArgumentException("Child " + node.getKind() + " belongs to a different arena");
        }
        return node.id;
    }

    protected static void requireKind(Syntax node, String slot, SyntaxKind... kinds) {
        if (node == null) {
            return;
        }
        for (SyntaxKind kind : kinds) {
            if (node.getKind() == kind) {
                return;
            }
        }
        throw new IllegalArgumentException("Unexpected " + node.getKind() + " in slot '" + slot + "'");
    }

    protected static void requireNonNull(Syntax node, String slot) {
        if (node == null) {
            throw new IllegalArgumentException("Slot '" + slot + "' is required");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Syntax)) return false;
        Syntax other = (Syntax) o;
        return arena == other.arena && id == other.id;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(arena) * 31 + id;
    }

    @Override
    public String toString() {
        return getKind() + "(" + getSourceText() + ")";
    }
}
