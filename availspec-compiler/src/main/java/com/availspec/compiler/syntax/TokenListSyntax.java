package com.availspec.compiler.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * 无法归入任何语法形式的参数，按原样收集的 token 序列（可为空）
 */
public final class TokenListSyntax extends Syntax {

    TokenListSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static TokenListSyntax create(SyntaxArena arena, List<TokenSyntax> tokens) {
        List<Integer> ids = new ArrayList<Integer>(tokens.size());
        for (TokenSyntax token : tokens) {
            ids.add(idOf(arena, token));
        }
        return new TokenListSyntax(arena, arena.record(RawSyntax.collection(SyntaxKind.TOKEN_LIST, ids)));
    }

    public List<TokenSyntax> getElements() {
        return getTokens();
    }

    public int size() {
        return getRaw().getChildCount();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitTokenList(this, context);
    }
}
