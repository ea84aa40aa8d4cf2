package org.vcad.ir.compact;

import org.junit.jupiter.api.Test;
import org.vcad.ir.CsgOp;
import org.vcad.ir.Document;
import org.vcad.ir.MaterialDef;
import org.vcad.ir.Node;
import org.vcad.ir.PathCurve;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.SketchSegment2D;
import org.vcad.ir.Vec2;
import org.vcad.ir.Vec3;
import org.vcad.ir.graph.DanglingReferenceException;
import org.vcad.ir.graph.GraphCycleException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompactEncoderTest {

    private static final String PLATE = "C 50 30 5\nY 5 10\nT 1 25 15 0\nD 0 2";

    @Test
    void toCompact_reproducesPlateText() {
        assertThat(CompactIr.toCompact(CompactIr.fromCompact(PLATE))).isEqualTo(PLATE);
    }

    @Test
    void toCompact_emptyDocument() {
        assertThat(CompactIr.toCompact(Document.empty())).isEmpty();
        assertThat(CompactIr.toCompact(Document.empty(), CompactEncodeOptions.v02())).isEqualTo("# vcad 0.2");
    }

    @Test
    void toCompact_renumbersSparseIdsInEmissionOrder() {
        Document doc = Document.ofNodes(List.of(
                new Node(10, new CsgOp.Cube(new Vec3(1, 2, 3))),
                new Node(20, new CsgOp.Sphere(3, 32)),
                new Node(30, new CsgOp.Union(20, 10))
        ));

        assertThat(CompactIr.toCompact(doc)).isEqualTo("S 3\nC 1 2 3\nU 0 1");
    }

    @Test
    void toCompact_emitsOrphansAfterEarlierRoots() {
        Document doc = Document.ofNodes(List.of(
                new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1))),
                new Node(1, new CsgOp.Sphere(1, 0)),
                new Node(2, new CsgOp.Translate(0, new Vec3(1, 0, 0)))
        ));

        String text = CompactIr.toCompact(doc);

        assertThat(text).isEqualTo("S 1\nC 1 1 1\nT 1 1 0 0");
        Document reparsed = CompactIr.fromCompact(text);
        assertThat(reparsed.nodes()).hasSize(3);
        assertThat(reparsed.roots()).extracting(SceneEntry::root).containsExactly(2L);
    }

    @Test
    void toCompact_writesEmptyAsZeroCube() {
        Document doc = Document.ofNodes(List.of(new Node(0, new CsgOp.Empty())));

        assertThat(CompactIr.toCompact(doc)).isEqualTo("C 0 0 0");
    }

    @Test
    void toCompact_sketchWithArcRoundTripsPreservingCcw() {
        CsgOp.Sketch2D sketch = new CsgOp.Sketch2D(Vec3.ZERO, new Vec3(1, 0, 0), new Vec3(0, 1, 0), List.of(
                new SketchSegment2D.Line(new Vec2(0, 0), new Vec2(10, 0)),
                new SketchSegment2D.Arc(new Vec2(10, 0), new Vec2(0, 10), new Vec2(0, 0), true)
        ));
        Document doc = Document.ofNodes(List.of(
                new Node(0, sketch),
                new Node(1, new CsgOp.Extrude(0, new Vec3(0, 0, 5)))
        ));

        String text = CompactIr.toCompact(doc);

        assertThat(text).isEqualTo("SK 0 0 0  1 0 0  0 1 0\nL 0 0 10 0\nA 10 0 0 10 0 0 1\nEND\nE 0 0 0 5");
        Document reparsed = CompactIr.fromCompact(text);
        CsgOp.Sketch2D decoded = (CsgOp.Sketch2D) reparsed.node(0).op();
        assertThat(decoded.segments()).hasSize(2);
        assertThat(decoded.segments().get(0)).isInstanceOf(SketchSegment2D.Line.class);
        assertThat(decoded.segments().get(1)).isInstanceOfSatisfying(SketchSegment2D.Arc.class,
                arc -> assertThat(arc.ccw()).isTrue());
        assertThat(decoded).isEqualTo(sketch);
    }

    @Test
    void toCompact_rejectsTwoNodeCycle() {
        Document doc = Document.ofNodes(List.of(
                new Node(0, new CsgOp.Union(1, 2)),
                new Node(1, new CsgOp.Translate(0, new Vec3(1, 0, 0))),
                new Node(2, new CsgOp.Cube(new Vec3(1, 1, 1)))
        ));

        assertThatThrownBy(() -> CompactIr.toCompact(doc))
                .isInstanceOfSatisfying(GraphCycleException.class, e -> assertThat(e.getNodeId()).isZero());
    }

    @Test
    void toCompact_rejectsSelfLoop() {
        Document doc = Document.ofNodes(List.of(new Node(4, new CsgOp.Scale(4, Vec3.ONE))));

        assertThatThrownBy(() -> CompactIr.toCompact(doc)).isInstanceOf(GraphCycleException.class);
    }

    @Test
    void toCompact_rejectsDanglingReference() {
        Document doc = Document.ofNodes(List.of(new Node(0, new CsgOp.Translate(7, Vec3.ZERO))));

        assertThatThrownBy(() -> CompactIr.toCompact(doc))
                .isInstanceOfSatisfying(DanglingReferenceException.class, e -> {
                    assertThat(e.getNodeId()).isZero();
                    assertThat(e.getMissingId()).isEqualTo(7);
                });
    }

    @Test
    void toCompact_rejectsOpsWithoutCompactForm() {
        CsgOp.Sketch2D sketch = new CsgOp.Sketch2D(Vec3.ZERO, new Vec3(1, 0, 0), new Vec3(0, 1, 0), List.of());
        Document sweep = Document.ofNodes(List.of(
                new Node(0, sketch),
                new Node(1, new CsgOp.Sweep(0, new PathCurve.Helix(5, 2, 10, 5), null, null, null, null, null))
        ));
        Document loft = Document.ofNodes(List.of(
                new Node(0, sketch),
                new Node(1, sketch),
                new Node(2, new CsgOp.Loft(List.of(0L, 1L), null))
        ));
        Document mesh = Document.ofNodes(List.of(
                new Node(0, new CsgOp.ImportedMesh(List.of(0.0, 0.0, 0.0), List.of(0L, 0L, 0L), null, "part.stl"))
        ));

        assertThatThrownBy(() -> CompactIr.toCompact(sweep))
                .isInstanceOf(CompactEncodeException.class).hasMessageContaining("Sweep");
        assertThatThrownBy(() -> CompactIr.toCompact(loft))
                .isInstanceOf(CompactEncodeException.class).hasMessageContaining("Loft");
        assertThatThrownBy(() -> CompactIr.toCompact(mesh))
                .isInstanceOf(CompactEncodeException.class).hasMessageContaining("ImportedMesh");
    }

    @Test
    void toCompact_rejectsNonFiniteNumbers() {
        Document doc = Document.ofNodes(List.of(new Node(0, new CsgOp.Sphere(Double.NaN, 0))));

        assertThatThrownBy(() -> CompactIr.toCompact(doc)).isInstanceOf(CompactEncodeException.class);
    }

    @Test
    void formatNumber_usesShortestPlainForm() {
        assertThat(CompactLineWriter.formatNumber(10.0)).isEqualTo("10");
        assertThat(CompactLineWriter.formatNumber(10.5)).isEqualTo("10.5");
        assertThat(CompactLineWriter.formatNumber(-0.25)).isEqualTo("-0.25");
        assertThat(CompactLineWriter.formatNumber(-0.0)).isEqualTo("0");
        assertThat(CompactLineWriter.formatNumber(0.1)).isEqualTo("0.1");
        assertThat(CompactLineWriter.formatNumber(1e-6)).isEqualTo("0.000001");
        assertThat(CompactLineWriter.formatNumber(123456789.125)).isEqualTo("123456789.125");
        assertThat(CompactLineWriter.formatNumber(1e20)).isEqualTo("100000000000000000000");
        assertThat(CompactLineWriter.formatNumber(1e-7)).isEqualTo("1.0E-7");
        assertThat(CompactLineWriter.formatNumber(1e21)).isEqualTo("1.0E21");
    }

    @Test
    void toCompact_v02KeepsMultiRootScene() {
        Document doc = new Document(
                Map.of(0L, new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1))),
                        1L, new Node(1, new CsgOp.Sphere(2, 0))),
                Map.of("steel", MaterialDef.grey("steel"), "default", MaterialDef.grey("default")),
                List.of(new SceneEntry(0, "steel"), new SceneEntry(1, "default"))
        );

        String text = CompactIr.toCompact(doc, CompactEncodeOptions.v02());

        assertThat(text).isEqualTo("# vcad 0.2\nC 1 1 1\nS 2\nROOT 0 steel\nROOT 1 default");
        Document reparsed = CompactIr.fromCompact(text);
        assertThat(reparsed.roots()).isEqualTo(doc.roots());
        assertThat(reparsed.nodes()).isEqualTo(doc.nodes());
    }

    @Test
    void toCompact_rootLinesUseRemappedIds() {
        Document doc = new Document(
                Map.of(5L, new Node(5, new CsgOp.Cube(new Vec3(1, 1, 1))),
                        9L, new Node(9, new CsgOp.Translate(5, new Vec3(0, 0, 1)))),
                Map.of("default", MaterialDef.grey("default")),
                List.of(new SceneEntry(9, "default"))
        );

        assertThat(CompactIr.toCompact(doc, new CompactEncodeOptions(false, true)))
                .isEqualTo("C 1 1 1\nT 0 0 0 1\nROOT 1 default");
    }

    @Test
    void toCompact_rejectsRootMaterialWithWhitespace() {
        Document doc = new Document(
                Map.of(0L, new Node(0, new CsgOp.Cube(new Vec3(1, 1, 1)))),
                Map.of(),
                List.of(new SceneEntry(0, "brushed steel"))
        );

        assertThatThrownBy(() -> CompactIr.toCompact(doc, CompactEncodeOptions.v02()))
                .isInstanceOf(CompactEncodeException.class);
    }
}
