package org.vcad.mcp.dto;

import java.util.List;

/**
 * {@code ir_to_compact} 的返回结果。
 *
 * @param compact   Compact IR 文本
 * @param lineCount 物理行数（包含草图段行、END、版本头与 ROOT 行）
 * @param nodeCount 节点数（即重编号后的 id 个数）
 * @param chars     文本长度
 * @param warnings  非致命提示
 */
public record CompactEncodeResult(
        String compact,
        int lineCount,
        int nodeCount,
        int chars,
        List<String> warnings
) {
}
