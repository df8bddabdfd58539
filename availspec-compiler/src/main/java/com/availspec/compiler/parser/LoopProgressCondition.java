package com.availspec.compiler.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 循环推进守卫：每次迭代前调用 {@link #evaluate(Parser)}，若游标自上次调用以来没有前进则返回 false 终止循环。
 *
 * <p>所有按 lookahead 条件重复消费 token 的循环都必须经过它，这是解析器总能终止的唯一保证。
 * 守卫本身不产生诊断。</p>
 */
public final class LoopProgressCondition {
    private static final Logger log = LoggerFactory.getLogger(LoopProgressCondition.class);

    private int lastPosition = -1;

    public boolean evaluate(Parser parser) {
        int position = parser.position();
        if (lastPosition < 0) {
            lastPosition = position;
            return true;
        }
        boolean progressed = position != lastPosition;
        if (!progressed) {
            log.debug("Loop made no progress at {} (position {}), stopping", parser.currentToken(), position);
        }
        lastPosition = position;
        return progressed;
    }
}
