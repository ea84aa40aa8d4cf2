package org.vcad.ir.compact;

import org.vcad.ir.Document;

/**
 * Compact IR 编解码入口。
 * <p>
 * 两个方向都是无状态的纯函数：每次调用只使用自己的局部数据结构，可以在多线程中并发调用。
 *
 * <pre>{@code
 * Document doc = CompactIr.fromCompact("C 50 30 5\nY 5 10\nT 1 25 15 0\nD 0 2");
 * String text = CompactIr.toCompact(doc);
 * }</pre>
 */
public final class CompactIr {

    private CompactIr() {
    }

    /**
     * 解析 Compact IR，按默认方式推断唯一的根。
     *
     * @throws CompactParseException 任意一行不合法
     */
    public static Document fromCompact(String input) {
        return fromCompact(input, CompactDecodeOptions.defaults());
    }

    public static Document fromCompact(String input, CompactDecodeOptions options) {
        return CompactDecoder.decode(input, options);
    }

    /**
     * 把文档编码为 Compact IR（节点 id 会按输出顺序重新编号）。
     *
     * @throws CompactEncodeException                   文档包含无法表示的操作或数值
     * @throws org.vcad.ir.graph.GraphCycleException        节点图存在环
     * @throws org.vcad.ir.graph.DanglingReferenceException 引用了不存在的节点
     */
    public static String toCompact(Document document) {
        return toCompact(document, CompactEncodeOptions.defaults());
    }

    public static String toCompact(Document document, CompactEncodeOptions options) {
        return CompactEncoder.encode(document, options);
    }
}
