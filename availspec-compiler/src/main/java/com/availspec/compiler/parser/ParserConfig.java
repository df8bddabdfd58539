package com.availspec.compiler.parser;

/**
 * 解析器配置
 */
public class ParserConfig {
    private String fileName = "<input>";
    private int recoveryLookahead = 3;

    public ParserConfig() {
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    /**
     * 期望的 token 不在当前位置时，最多向后查看多少个 token 寻找它。
     * 找到则把中间的 token 记为 unexpected，否则合成 missing token。查看范围不会越过 ',' ')' 和 EOF。
     */
    public int getRecoveryLookahead() {
        return recoveryLookahead;
    }

    public void setRecoveryLookahead(int recoveryLookahead) {
        if (recoveryLookahead < 0) {
            throw new IllegalArgumentException("recoveryLookahead must not be negative: " + recoveryLookahead);
        }
        this.recoveryLookahead = recoveryLookahead;
    }
}
