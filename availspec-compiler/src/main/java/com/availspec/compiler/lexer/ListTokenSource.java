package com.availspec.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 预先词法分析好的 token 列表。
 * 若列表不以 EOF 结尾，则在末尾补一个合成的 EOF。
 */
public final class ListTokenSource implements TokenSource {
    private final List<Token> tokens;
    private int position;

    public ListTokenSource(List<Token> tokens) {
        List<Token> copy = new ArrayList<Token>(tokens);
        if (copy.isEmpty() || !copy.get(copy.size() - 1).is(TokenType.EOF)) {
            int offset = 0;
            int line = 1;
            int column = 1;
            if (!copy.isEmpty()) {
                Token last = copy.get(copy.size() - 1);
                offset = last.getOffset() + last.getText().length() + last.getTrailingTrivia().length();
                line = last.getLine();
                column = last.getColumn() + last.getText().length() + last.getTrailingTrivia().length();
            }
            copy.add(new Token(TokenType.EOF, "", line, column, offset));
        }
        this.tokens = copy;
    }

    @Override
    public Token nextToken() {
        Token token = tokens.get(position);
        // EOF 之后停在原地
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    public List<Token> getTokens() {
        return tokens;
    }
}
