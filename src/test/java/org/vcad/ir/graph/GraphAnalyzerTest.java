package org.vcad.ir.graph;

import org.junit.jupiter.api.Test;
import org.vcad.ir.CsgOp;
import org.vcad.ir.Document;
import org.vcad.ir.Instance;
import org.vcad.ir.Joint;
import org.vcad.ir.JointKind;
import org.vcad.ir.MaterialDef;
import org.vcad.ir.Node;
import org.vcad.ir.PartDef;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.Transform3D;
import org.vcad.ir.Vec3;
import org.vcad.ir.compact.CompactIr;
import org.vcad.ir.json.DocumentJson;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GraphAnalyzerTest {

    @Test
    void analyze_summarizesPlate() {
        Document doc = CompactIr.fromCompact("C 50 30 5\nY 5 10\nT 1 25 15 0\nD 0 2");

        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        assertThat(analysis.nodeCount()).isEqualTo(4);
        assertThat(analysis.opCounts()).containsExactly(
                Map.entry("Cube", 1), Map.entry("Cylinder", 1), Map.entry("Difference", 1), Map.entry("Translate", 1));
        assertThat(analysis.unreferenced()).containsExactly(3L);
        assertThat(analysis.sceneRoots()).containsExactly(new SceneEntry(3, "default"));
        assertThat(analysis.maxDepth()).isEqualTo(3);
        assertThat(analysis.danglingReferences()).isEmpty();
        assertThat(analysis.cycleNodeId()).isNull();
        assertThat(analysis.warnings()).isEmpty();
        assertThat(analysis.structurallyValid()).isTrue();
    }

    @Test
    void analyze_collectsDanglingReferencesInsteadOfThrowing() {
        Document doc = Document.ofNodes(List.of(
                new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1))),
                new Node(1, new CsgOp.Union(0, 9))
        ));

        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        assertThat(analysis.danglingReferences()).containsExactly(new GraphAnalyzer.DanglingRef(1, 9));
        assertThat(analysis.maxDepth()).isNull();
        assertThat(analysis.structurallyValid()).isFalse();
    }

    @Test
    void analyze_reportsCycle() {
        Document doc = Document.ofNodes(List.of(
                new Node(0, new CsgOp.Translate(1, Vec3.ZERO)),
                new Node(1, new CsgOp.Translate(0, Vec3.ZERO))
        ));

        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        assertThat(analysis.cycleNodeId()).isNotNull();
        assertThat(analysis.maxDepth()).isNull();
        assertThat(analysis.warnings()).anyMatch(w -> w.contains("环"));
    }

    @Test
    void analyze_flagsNonSketchInputsAndUnknownMaterials() {
        Document doc = new Document(
                Map.of(0L, new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1))),
                        1L, new Node(1, new CsgOp.Extrude(0, new Vec3(0, 0, 1)))),
                Map.of(),
                List.of(new SceneEntry(1, "steel"), new SceneEntry(8, "default"))
        );

        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        assertThat(analysis.warnings()).hasSize(4);
        assertThat(analysis.warnings()).anyMatch(w -> w.contains("不是 Sketch2D"));
        assertThat(analysis.warnings()).anyMatch(w -> w.contains("steel"));
        assertThat(analysis.warnings()).anyMatch(w -> w.contains("不存在的节点 8"));
    }

    @Test
    void analyze_checksAssemblyReferences() {
        Map<Long, Node> nodes = Map.of(0L, new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1))));
        Document doc = new Document(
                "0.1",
                nodes,
                Map.of("default", MaterialDef.grey("default")),
                Map.of(),
                List.of(new SceneEntry(0, "default")),
                Map.of("base", new PartDef("base", "Base", 0, null),
                        "arm", new PartDef("arm", "Arm", 5, null)),
                List.of(new Instance("i1", "base", null, Transform3D.identity(), null),
                        new Instance("i2", "wheel", null, null, null)),
                List.of(new Joint("j1", null, "i1", "i3", Vec3.ZERO, Vec3.ZERO,
                        new JointKind.Revolute(new Vec3(0, 0, 1), List.of(-90.0, 90.0)), 0)),
                "i9"
        );

        List<String> warnings = GraphAnalyzer.analyze(doc).warnings();

        assertThat(warnings).hasSize(4);
        assertThat(warnings).anyMatch(w -> w.contains("arm") && w.contains("5"));
        assertThat(warnings).anyMatch(w -> w.contains("i2") && w.contains("wheel"));
        assertThat(warnings).anyMatch(w -> w.contains("j1") && w.contains("i3"));
        assertThat(warnings).anyMatch(w -> w.contains("i9"));
    }

    @Test
    void analyze_warnsOnSceneRootWithoutMaterial() {
        Document doc = DocumentJson.fromJson("""
                {"nodes": {"0": {"id": 0, "op": {"type": "Cube", "size": {"x": 1, "y": 1, "z": 1}}}},
                 "roots": [{"root": 0}]}
                """);

        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        assertThat(analysis.structurallyValid()).isTrue();
        assertThat(analysis.warnings()).singleElement().satisfies(w -> assertThat(w).contains("缺少材质键"));
    }

    @Test
    void analyze_warnsOnInstanceWithoutPartDef() {
        Document doc = DocumentJson.fromJson("""
                {"nodes": {}, "instances": [{"id": "a"}]}
                """);

        List<String> warnings = GraphAnalyzer.analyze(doc).warnings();

        assertThat(warnings).singleElement().satisfies(w -> assertThat(w).contains("a").contains("partDefId"));
    }
}
