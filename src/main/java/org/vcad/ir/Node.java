package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * 文档图中的一个节点。
 *
 * @param id   节点 id（与所在 map 的键一致）
 * @param name 可选的显示名称，JSON 中始终输出（无名称时为 null）
 * @param op   节点对应的操作
 */
public record Node(
        long id,
        @JsonInclude(JsonInclude.Include.ALWAYS) String name,
        CsgOp op
) {

    public Node {
        if (id < 0) {
            throw new IllegalArgumentException("节点 id 不能为负数：" + id);
        }
        Objects.requireNonNull(op, "op");
    }

    public Node(long id, CsgOp op) {
        this(id, null, op);
    }
}
