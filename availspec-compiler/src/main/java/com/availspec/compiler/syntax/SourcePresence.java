package com.availspec.compiler.syntax;

/**
 * token 是否真实出现在源码中
 */
public enum SourcePresence {
    PRESENT,
    /** 语法要求但输入缺失，由解析器合成的占位 token */
    MISSING
}
