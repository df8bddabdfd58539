package com.availspec.compiler.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法位置上未预期的 token，挂在其后续语法元素之前，原样保留
 */
public final class UnexpectedNodesSyntax extends Syntax {

    UnexpectedNodesSyntax(SyntaxArena arena, int id) {
        super(arena, id);
    }

    public static UnexpectedNodesSyntax create(SyntaxArena arena, List<TokenSyntax> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Unexpected nodes must capture at least one token");
        }
        List<Integer> ids = new ArrayList<Integer>(tokens.size());
        for (TokenSyntax token : tokens) {
            ids.add(idOf(arena, token));
        }
        return new UnexpectedNodesSyntax(arena, arena.record(RawSyntax.collection(SyntaxKind.UNEXPECTED_NODES, ids)));
    }

    public List<TokenSyntax> getElements() {
        return getTokens();
    }

    @Override
    public <R, C> R accept(SyntaxVisitor<R, C> visitor, C context) {
        return visitor.visitUnexpectedNodes(this, context);
    }
}
