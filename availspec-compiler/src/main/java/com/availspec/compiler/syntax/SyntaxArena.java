package com.availspec.compiler.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次解析产生的全部节点的拥有者。
 *
 * <p>只追加、按整数句柄寻址；节点之间通过句柄而不是对象引用相连，因此树天然无环。
 * 解析期间仅由一个线程写入，解析返回后可并发读取。</p>
 */
public final class SyntaxArena {

    /** 缺席槽位的句柄 */
    public static final int ABSENT = -1;

    private final List<RawSyntax> nodes = new ArrayList<RawSyntax>();

    int record(RawSyntax node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    public RawSyntax get(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("No node with handle " + id + " in arena of size " + nodes.size());
        }
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }
}
