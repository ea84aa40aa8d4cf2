package org.vcad.ir.compact;

import org.vcad.ir.MaterialDef;
import org.vcad.ir.Node;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.graph.GraphReferences;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 解码后的根推断：根是未被任何节点引用的节点。
 */
final class RootInference {

    private RootInference() {
    }

    static List<SceneEntry> infer(Map<Long, Node> nodes, RootMode mode) {
        List<Long> unreferenced = GraphReferences.unreferenced(nodes);
        if (unreferenced.isEmpty()) {
            return List.of();
        }
        if (mode == RootMode.SINGLE) {
            // 最后定义的未引用节点；节点表为升序，取末尾即可
            long root = unreferenced.get(unreferenced.size() - 1);
            return List.of(new SceneEntry(root, MaterialDef.DEFAULT_KEY));
        }
        List<SceneEntry> roots = new ArrayList<>(unreferenced.size());
        for (Long id : unreferenced) {
            roots.add(new SceneEntry(id, MaterialDef.DEFAULT_KEY));
        }
        return roots;
    }
}
