package org.vcad.mcp.dto;

import com.fasterxml.jackson.databind.JsonNode;
import org.vcad.ir.SceneEntry;

import java.util.List;

/**
 * {@code ir_parse_compact} 的返回结果。
 *
 * @param nodeCount 节点数
 * @param roots     场景根（解码推断或 ROOT 行声明）
 * @param document  文档 JSON
 * @param warnings  非致命提示（例如存在多个未引用节点但只推断了一个根）
 */
public record CompactDecodeResult(
        int nodeCount,
        List<SceneEntry> roots,
        JsonNode document,
        List<String> warnings
) {
}
