package com.availspec.compiler.syntax;

/**
 * 语法节点种类
 */
public enum SyntaxKind {
    TOKEN,
    UNEXPECTED_NODES,
    TOKEN_LIST,
    VERSION_TUPLE,
    AVAILABILITY_CONSTRAINT,
    LABELED_ARGUMENT,
    AVAILABILITY_ARGUMENT,
    AVAILABILITY_ARGUMENT_LIST,
    AVAILABILITY_CONDITION,
    AVAILABILITY_ATTRIBUTE
}
