package org.vcad.ir.compact;

import org.vcad.ir.Document;
import org.vcad.ir.Node;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.graph.TopologicalSorter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Document} → Compact IR 文本。
 * <p>
 * 先拓扑排序（子节点在前），再按输出顺序把 id 重新编号为 0..n-1，最后逐个节点格式化。
 * 只读访问输入文档。
 */
final class CompactEncoder {

    private CompactEncoder() {
    }

    static String encode(Document document, CompactEncodeOptions options) {
        Map<Long, Node> nodes = document.nodes();
        List<Long> order = TopologicalSorter.sort(nodes);

        Map<Long, Integer> remap = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            remap.put(order.get(i), i);
        }

        CompactLineWriter writer = new CompactLineWriter(remap);
        if (options.versionHeader()) {
            writer.line(CompactSyntax.VERSION_HEADER);
        }
        for (Long id : order) {
            Node node = nodes.get(id);
            Opcode opcode = Opcode.forOp(node.op());
            if (opcode == null) {
                throw new CompactEncodeException(
                        "节点 " + id + " 的操作 " + node.op().typeName() + " 没有 Compact IR 表示");
            }
            opcode.write(node.op(), writer);
        }
        if (options.sceneRoots()) {
            for (SceneEntry entry : document.roots()) {
                writeRoot(entry, remap, writer);
            }
        }
        return writer.toString();
    }

    private static void writeRoot(SceneEntry entry, Map<Long, Integer> remap, CompactLineWriter writer) {
        if (!remap.containsKey(entry.root())) {
            throw new CompactEncodeException("场景根引用了不存在的节点 " + entry.root());
        }
        String material = entry.material();
        if (material == null || material.isEmpty() || material.chars().anyMatch(Character::isWhitespace)) {
            throw new CompactEncodeException("材质键不能为空或包含空白，无法写入 ROOT 行：" + material);
        }
        writer.line(CompactSyntax.ROOT).ref(entry.root()).word(material);
    }
}
