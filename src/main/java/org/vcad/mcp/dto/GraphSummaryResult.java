package org.vcad.mcp.dto;

import org.vcad.ir.SceneEntry;

import java.util.List;
import java.util.Map;

/**
 * {@code ir_inspect_document} 的返回结果。
 *
 * @param format             输入格式：{@code json} 或 {@code compact}
 * @param nodeCount          节点数
 * @param opCounts           按操作类型计数
 * @param roots              场景根
 * @param unreferenced       未被引用的节点 id
 * @param maxDepth           最长引用链上的节点数（有环或悬空引用时为 null）
 * @param danglingReferences 悬空引用，形如 {@code 3 -> 9}
 * @param cycleNodeId        环上的一个节点（无环为 null）
 * @param compactEncodable   能否编码为 Compact IR
 * @param warnings           结构问题
 */
public record GraphSummaryResult(
        String format,
        int nodeCount,
        Map<String, Integer> opCounts,
        List<SceneEntry> roots,
        List<Long> unreferenced,
        Integer maxDepth,
        List<String> danglingReferences,
        Long cycleNodeId,
        boolean compactEncodable,
        List<String> warnings
) {
}
