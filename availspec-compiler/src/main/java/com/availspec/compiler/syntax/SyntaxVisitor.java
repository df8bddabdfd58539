package com.availspec.compiler.syntax;

/**
 * 语法树访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。
 * 遍历子节点由实现类自行决定。</p>
 */
public interface SyntaxVisitor<R, C> {

    default R visitToken(TokenSyntax node, C ctx) { return null; }

    default R visitUnexpectedNodes(UnexpectedNodesSyntax node, C ctx) { return null; }

    default R visitTokenList(TokenListSyntax node, C ctx) { return null; }

    default R visitVersionTuple(VersionTupleSyntax node, C ctx) { return null; }

    default R visitAvailabilityConstraint(AvailabilityConstraintSyntax node, C ctx) { return null; }

    default R visitLabeledArgument(AvailabilityLabeledArgumentSyntax node, C ctx) { return null; }

    default R visitAvailabilityArgument(AvailabilityArgumentSyntax node, C ctx) { return null; }

    default R visitAvailabilityArgumentList(AvailabilityArgumentListSyntax node, C ctx) { return null; }

    default R visitAvailabilityClause(AvailabilityClauseSyntax node, C ctx) { return null; }
}
