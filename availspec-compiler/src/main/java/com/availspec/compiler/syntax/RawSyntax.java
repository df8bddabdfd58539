package com.availspec.compiler.syntax;

import com.availspec.compiler.lexer.Token;

import java.util.Arrays;
import java.util.List;

/**
 * arena 中存储的原始节点：token 叶子或按句柄引用子节点的复合节点。构造后不可变。
 */
public final class RawSyntax {
    private final SyntaxKind kind;
    private final SourcePresence presence;
    private final Token token;
    private final int[] children;

    private RawSyntax(SyntaxKind kind, SourcePresence presence, Token token, int[] children) {
        this.kind = kind;
        this.presence = presence;
        this.token = token;
        this.children = children;
    }

    static RawSyntax token(Token token, SourcePresence presence) {
        return new RawSyntax(SyntaxKind.TOKEN, presence, token, new int[0]);
    }

    /** 固定槽位的复合节点，缺席的槽位为 {@link SyntaxArena#ABSENT} */
    static RawSyntax layout(SyntaxKind kind, int... children) {
        return new RawSyntax(kind, SourcePresence.PRESENT, null, children.clone());
    }

    static RawSyntax collection(SyntaxKind kind, List<Integer> elements) {
        int[] children = new int[elements.size()];
        for (int i = 0; i < children.length; i++) {
            children[i] = elements.get(i);
        }
        return new RawSyntax(kind, SourcePresence.PRESENT, null, children);
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public SourcePresence getPresence() {
        return presence;
    }

    public boolean isToken() {
        return kind == SyntaxKind.TOKEN;
    }

    /** 叶子节点的 token，复合节点返回 null */
    public Token getToken() {
        return token;
    }

    public int getChildCount() {
        return children.length;
    }

    public int getChild(int slot) {
        return children[slot];
    }

    @Override
    public String toString() {
        if (isToken()) {
            return kind + "[" + presence + " " + token + "]";
        }
        return kind + Arrays.toString(children);
    }
}
