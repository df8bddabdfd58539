package com.availspec.compiler.lexer;

/**
 * 流式 token 来源。到达末尾后必须持续返回 EOF。
 */
public interface TokenSource {

    Token nextToken();
}
