package com.availspec.compiler.parser;

import com.availspec.compiler.lexer.Token;
import com.availspec.compiler.lexer.TokenType;
import com.availspec.compiler.syntax.AvailabilityArgumentSyntax;
import com.availspec.compiler.syntax.Syntax;
import com.availspec.compiler.syntax.SyntaxKind;
import com.availspec.compiler.syntax.SyntaxVisitor;
import com.availspec.compiler.syntax.TokenListSyntax;
import com.availspec.compiler.syntax.TokenSyntax;
import com.availspec.compiler.syntax.UnexpectedNodesSyntax;

import java.util.ArrayList;
import java.util.List;

/**
 * 按源码顺序遍历语法树，把 missing / unexpected 标记和无法识别的参数整理为 {@link ParseError} 列表
 */
public final class ParseErrorCollector implements SyntaxVisitor<Void, List<ParseError>> {

    /** 遍历到目前为止最后一个真实出现的 token，空节点的错误定位在它上面 */
    private Token lastPresent;

    private ParseErrorCollector() {
    }

    public static List<ParseError> collect(Syntax root) {
        List<ParseError> errors = new ArrayList<ParseError>();
        new ParseErrorCollector().walk(root, errors);
        return errors;
    }

    private void walk(Syntax node, List<ParseError> errors) {
        node.accept(this, errors);
        // 整段报告，不再逐个 token 报告
        if (node.getKind() == SyntaxKind.UNEXPECTED_NODES || node.getKind() == SyntaxKind.TOKEN_LIST) {
            rememberLastPresent(node);
            return;
        }
        for (Syntax child : node.getChildren()) {
            walk(child, errors);
        }
    }

    private void rememberLastPresent(Syntax node) {
        for (TokenSyntax token : node.getTokens()) {
            if (token.isPresent()) {
                lastPresent = token.getToken();
            }
        }
    }

    @Override
    public Void visitToken(TokenSyntax node, List<ParseError> errors) {
        if (node.isMissing()) {
            errors.add(new ParseError("Expected " + describe(node.getTokenType()),
                    ParseError.Kind.MISSING_TOKEN, node.getToken()));
        } else {
            lastPresent = node.getToken();
        }
        return null;
    }

    @Override
    public Void visitUnexpectedNodes(UnexpectedNodesSyntax node, List<ParseError> errors) {
        errors.add(new ParseError("Unexpected text '" + node.getSourceText().trim() + "'",
                ParseError.Kind.UNEXPECTED_TOKENS, node.getFirstPresentToken()));
        return null;
    }

    /**
     * 空的原样收集没有自己的 token：优先定位在该参数的尾随逗号上，否则定位在它前面的 token 上
     */
    @Override
    public Void visitAvailabilityArgument(AvailabilityArgumentSyntax node, List<ParseError> errors) {
        TokenListSyntax tokens = node.getTokenList();
        if (tokens != null && tokens.isEmpty()) {
            TokenSyntax comma = node.getTrailingComma();
            Token anchor = comma != null ? comma.getToken() : lastPresent;
            errors.add(new ParseError("Expected availability argument", ParseError.Kind.UNKNOWN_ARGUMENT, anchor));
        }
        return null;
    }

    @Override
    public Void visitTokenList(TokenListSyntax node, List<ParseError> errors) {
        if (!node.isEmpty()) {
            errors.add(new ParseError("Unknown availability argument '" + node.getSourceText().trim() + "'",
                    ParseError.Kind.UNKNOWN_ARGUMENT, node.getFirstPresentToken()));
        }
        return null;
    }

    private static String describe(TokenType type) {
        String spelling = type.getSpelling();
        if (spelling != null) {
            return "'" + spelling + "'";
        }
        switch (type) {
            case INTEGER_LITERAL:
            case FLOATING_LITERAL:
                return "version number";
            case STRING_LITERAL:
                return "string literal";
            case IDENTIFIER:
                return "identifier";
            default:
                return type.name().toLowerCase();
        }
    }
}
