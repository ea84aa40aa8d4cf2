package org.vcad.ir.compact;

/**
 * 文档无法表示为 Compact IR（不支持的操作、非有限数值、非法的场景根等）。
 * <p>
 * 图结构问题（环、悬空引用）由 {@link org.vcad.ir.graph.GraphException} 表示。
 */
public class CompactEncodeException extends RuntimeException {

    public CompactEncodeException(String message) {
        super(message);
    }
}
