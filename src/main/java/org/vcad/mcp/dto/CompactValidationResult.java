package org.vcad.mcp.dto;

/**
 * {@code ir_validate_compact} 的返回结果。
 *
 * @param valid     是否通过
 * @param error     错误码：{@code parse_error}/{@code empty_document}/{@code no_roots}；通过时为 null
 * @param message   错误说明
 * @param line      解析失败的物理行号（从 0 开始）
 * @param nodeCount 解析成功时的节点数
 */
public record CompactValidationResult(
        boolean valid,
        String error,
        String message,
        Integer line,
        Integer nodeCount
) {
}
