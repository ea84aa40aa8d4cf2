package org.vcad.ir.graph;

import org.vcad.ir.CsgOp;
import org.vcad.ir.Document;
import org.vcad.ir.Instance;
import org.vcad.ir.Joint;
import org.vcad.ir.Node;
import org.vcad.ir.PartDef;
import org.vcad.ir.SceneEntry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 文档结构分析：节点统计、根、深度、悬空引用、环以及装配扩展中的引用问题。
 * <p>
 * 与编码器不同，这里不会因为结构问题抛异常，而是把问题收集进结果，便于调用方一次看到全部问题。
 * 不做几何合理性检查（例如半径为 0 的圆柱是合法的）。
 */
public final class GraphAnalyzer {

    private GraphAnalyzer() {
    }

    /**
     * 悬空引用：{@code nodeId} 的操作引用了不存在的 {@code missingId}。
     */
    public record DanglingRef(long nodeId, long missingId) {
    }

    /**
     * @param nodeCount          节点数
     * @param opCounts           按操作类型计数（类型名升序）
     * @param sceneRoots         文档声明的场景根
     * @param unreferenced       未被引用的节点 id（升序）
     * @param maxDepth           最长引用链上的节点数；存在环或悬空引用时为 null
     * @param danglingReferences 悬空引用列表
     * @param cycleNodeId        检测到环时环上的一个节点；无环为 null
     * @param warnings           其它结构问题（草图输入类型、场景根、装配引用等）
     */
    public record Analysis(
            int nodeCount,
            Map<String, Integer> opCounts,
            List<SceneEntry> sceneRoots,
            List<Long> unreferenced,
            Integer maxDepth,
            List<DanglingRef> danglingReferences,
            Long cycleNodeId,
            List<String> warnings
    ) {

        public boolean structurallyValid() {
            return danglingReferences.isEmpty() && cycleNodeId == null;
        }
    }

    public static Analysis analyze(Document document) {
        Map<Long, Node> nodes = document.nodes();
        List<String> warnings = new ArrayList<>();

        Map<String, Integer> opCounts = new TreeMap<>();
        List<DanglingRef> dangling = new ArrayList<>();
        for (Node node : nodes.values()) {
            opCounts.merge(node.op().typeName(), 1, Integer::sum);
            for (Long child : node.op().children()) {
                if (!nodes.containsKey(child)) {
                    dangling.add(new DanglingRef(node.id(), child));
                }
            }
            for (Long input : node.op().sketchInputs()) {
                Node target = nodes.get(input);
                if (target != null && !(target.op() instanceof CsgOp.Sketch2D)) {
                    warnings.add("节点 " + node.id() + "（" + node.op().typeName() + "）的草图输入 " + input
                            + " 不是 Sketch2D，而是 " + target.op().typeName());
                }
            }
        }

        Integer maxDepth = null;
        Long cycleNodeId = null;
        if (dangling.isEmpty()) {
            try {
                maxDepth = maxDepth(nodes, TopologicalSorter.sort(nodes));
            } catch (GraphCycleException e) {
                cycleNodeId = e.getNodeId();
                warnings.add(e.getMessage());
            }
        }

        for (SceneEntry entry : document.roots()) {
            if (!nodes.containsKey(entry.root())) {
                warnings.add("场景根引用了不存在的节点 " + entry.root());
            }
            if (entry.material() == null) {
                warnings.add("场景根 " + entry.root() + " 缺少材质键");
            } else if (!document.materials().containsKey(entry.material())) {
                warnings.add("场景根 " + entry.root() + " 使用了未定义的材质 " + entry.material());
            }
        }
        checkAssembly(document, warnings);

        return new Analysis(
                nodes.size(),
                opCounts,
                document.roots(),
                GraphReferences.unreferenced(nodes),
                maxDepth,
                dangling,
                cycleNodeId,
                warnings
        );
    }

    // order 中子节点总在父节点之前，按顺序递推即可得到每个节点的深度。
    private static int maxDepth(Map<Long, Node> nodes, List<Long> order) {
        Map<Long, Integer> depth = new HashMap<>();
        int max = 0;
        for (Long id : order) {
            int d = 1;
            for (Long child : nodes.get(id).op().children()) {
                d = Math.max(d, depth.get(child) + 1);
            }
            depth.put(id, d);
            max = Math.max(max, d);
        }
        return max;
    }

    private static void checkAssembly(Document document, List<String> warnings) {
        Map<String, PartDef> partDefs = document.partDefs() == null ? Map.of() : document.partDefs();
        for (Map.Entry<String, PartDef> entry : partDefs.entrySet()) {
            if (entry.getValue() == null) {
                warnings.add("零件定义 " + entry.getKey() + " 为 null");
            } else if (!document.nodes().containsKey(entry.getValue().root())) {
                warnings.add("零件定义 " + entry.getKey() + " 的根节点 " + entry.getValue().root() + " 不存在");
            }
        }

        Set<String> instanceIds = new HashSet<>();
        if (document.instances() != null) {
            for (Instance instance : document.instances()) {
                if (!instanceIds.add(instance.id())) {
                    warnings.add("实例 id 重复：" + instance.id());
                }
                if (instance.partDefId() == null) {
                    warnings.add("实例 " + instance.id() + " 缺少 partDefId");
                } else if (!partDefs.containsKey(instance.partDefId())) {
                    warnings.add("实例 " + instance.id() + " 引用了不存在的零件定义 " + instance.partDefId());
                }
            }
        }

        if (document.joints() != null) {
            for (Joint joint : document.joints()) {
                if (joint.parentInstanceId() != null && !instanceIds.contains(joint.parentInstanceId())) {
                    warnings.add("关节 " + joint.id() + " 的父实例 " + joint.parentInstanceId() + " 不存在");
                }
                if (!instanceIds.contains(joint.childInstanceId())) {
                    warnings.add("关节 " + joint.id() + " 的子实例 " + joint.childInstanceId() + " 不存在");
                }
            }
        }

        if (document.groundInstanceId() != null && !instanceIds.contains(document.groundInstanceId())) {
            warnings.add("固定实例 " + document.groundInstanceId() + " 不存在");
        }
    }
}
