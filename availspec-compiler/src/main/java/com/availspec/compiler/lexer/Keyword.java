package com.availspec.compiler.lexer;

/**
 * 上下文关键词：词法上仍是 IDENTIFIER，仅在特定语法位置按文本识别
 */
public enum Keyword {
    // availability 参数标签
    MESSAGE("message"),
    RENAMED("renamed"),
    INTRODUCED("introduced"),
    DEPRECATED("deprecated"),
    OBSOLETED("obsoleted"),
    UNAVAILABLE("unavailable"),
    NOASYNC("noasync"),

    // 平台无关版本标记
    SWIFT("swift"),
    PACKAGE_DESCRIPTION("_PackageDescription"),

    // #available / @available
    AVAILABLE("available");

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
