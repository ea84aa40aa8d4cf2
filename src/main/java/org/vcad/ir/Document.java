package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * vcad 文档（{@code .vcad} 文件格式）。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@link #nodes} 按 id 升序保存，构成一张 DAG；子引用都是节点 id，而不是对象引用。</li>
 *   <li>构造后不可变：所有集合都会被拷贝为只读视图。</li>
 *   <li>装配扩展（partDefs/instances/joints/groundInstanceId）可选，缺省为 null，序列化时省略。</li>
 * </ul>
 *
 * @param version          文档版本号，原样携带，不做迁移
 * @param nodes            节点表（id → 节点）
 * @param materials        材质表（键 → 材质）
 * @param partMaterials    零件名 → 材质键
 * @param roots            场景根
 * @param partDefs         零件定义（可选）
 * @param instances        实例（可选）
 * @param joints           关节（可选）
 * @param groundInstanceId 固定在世界坐标系中的实例（可选）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
        String version,
        Map<Long, Node> nodes,
        Map<String, MaterialDef> materials,
        @JsonProperty("part_materials") Map<String, String> partMaterials,
        List<SceneEntry> roots,
        Map<String, PartDef> partDefs,
        List<Instance> instances,
        List<Joint> joints,
        String groundInstanceId
) {

    public static final String DEFAULT_VERSION = "0.1";

    public Document {
        version = version == null ? DEFAULT_VERSION : version;
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(nodes));
        materials = materials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(materials));
        partMaterials = partMaterials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(partMaterials));
        roots = roots == null ? List.of() : List.copyOf(roots);
        partDefs = partDefs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(partDefs));
        instances = instances == null ? null : List.copyOf(instances);
        joints = joints == null ? null : List.copyOf(joints);
    }

    /**
     * 只有节点、材质与场景根的文档（不含装配扩展）。
     */
    public Document(Map<Long, Node> nodes, Map<String, MaterialDef> materials, List<SceneEntry> roots) {
        this(DEFAULT_VERSION, nodes, materials, Map.of(), roots, null, null, null, null);
    }

    public static Document empty() {
        return new Document(Map.of(), Map.of(), List.of());
    }

    /**
     * 由节点列表构造文档（不设置场景根），主要用于程序化构图。
     */
    public static Document ofNodes(List<Node> nodes) {
        Map<Long, Node> map = new TreeMap<>();
        for (Node node : nodes) {
            if (map.put(node.id(), node) != null) {
                throw new IllegalArgumentException("节点 id 重复：" + node.id());
            }
        }
        return new Document(map, Map.of(), List.of());
    }

    public Node node(long id) {
        return nodes.get(id);
    }
}
