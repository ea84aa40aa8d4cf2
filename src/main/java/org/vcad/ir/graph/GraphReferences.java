package org.vcad.ir.graph;

import org.vcad.ir.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点引用关系的基础计算：被引用集合与未被引用的节点（根候选）。
 * <p>
 * 解码时的根推断与编码时的排序起点都基于这里的结果，两侧口径保持一致。
 */
public final class GraphReferences {

    private GraphReferences() {
    }

    /**
     * 所有被其它节点作为子节点引用过的 id（不要求该 id 存在于节点表中）。
     */
    public static Set<Long> referenced(Map<Long, Node> nodes) {
        Set<Long> referenced = new HashSet<>();
        for (Node node : nodes.values()) {
            referenced.addAll(node.op().children());
        }
        return referenced;
    }

    /**
     * 未被任何节点引用的 id，按节点表的迭代顺序返回（文档节点表为升序）。
     */
    public static List<Long> unreferenced(Map<Long, Node> nodes) {
        Set<Long> referenced = referenced(nodes);
        List<Long> result = new ArrayList<>();
        for (Long id : nodes.keySet()) {
            if (!referenced.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }
}
