package org.vcad.ir.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.vcad.ir.CsgOp;
import org.vcad.ir.Document;
import org.vcad.ir.JointKind;
import org.vcad.ir.Node;
import org.vcad.ir.PathCurve;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.SketchSegment2D;
import org.vcad.ir.Vec2;
import org.vcad.ir.Vec3;
import org.vcad.ir.compact.CompactIr;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void toJson_writesDocumentContract() throws Exception {
        Document doc = CompactIr.fromCompact("C 50 30 5\nK 3 1 4\nT 1 25 15 0\nD 0 2");

        JsonNode tree = MAPPER.readTree(DocumentJson.toJson(doc));

        assertThat(tree.get("version").asText()).isEqualTo("0.1");
        assertThat(tree.at("/nodes/0/op/type").asText()).isEqualTo("Cube");
        assertThat(tree.at("/nodes/0/op/size/x").asDouble()).isEqualTo(50.0);
        assertThat(tree.at("/nodes/0/id").asLong()).isZero();
        assertThat(tree.at("/nodes/0").has("name")).isTrue();
        assertThat(tree.at("/nodes/0/name").isNull()).isTrue();
        assertThat(tree.at("/nodes/1/op/radius_bottom").asDouble()).isEqualTo(3.0);
        assertThat(tree.at("/nodes/1/op/radius_top").asDouble()).isEqualTo(1.0);
        assertThat(tree.at("/nodes/3/op/type").asText()).isEqualTo("Difference");
        assertThat(tree.at("/nodes/3/op/left").asLong()).isZero();
        assertThat(tree.at("/materials/default/color").size()).isEqualTo(3);
        assertThat(tree.at("/materials/default").has("density")).isFalse();
        assertThat(tree.has("part_materials")).isTrue();
        assertThat(tree.at("/roots/0/root").asLong()).isEqualTo(3);
        assertThat(tree.at("/roots/0/material").asText()).isEqualTo("default");
        assertThat(tree.has("partDefs")).isFalse();
        assertThat(tree.has("groundInstanceId")).isFalse();
    }

    @Test
    void toJson_usesSnakeCaseForSketchAndRevolveFields() {
        Document doc = CompactIr.fromCompact("SK 0 0 0 1 0 0 0 1 0\nA 1 0 0 1 0 0 0\nEND\nV 0 0 0 0 0 1 0 180");

        JsonNode tree = DocumentJson.toTree(doc);

        assertThat(tree.at("/nodes/0/op/x_dir/x").asDouble()).isEqualTo(1.0);
        assertThat(tree.at("/nodes/0/op/y_dir/y").asDouble()).isEqualTo(1.0);
        assertThat(tree.at("/nodes/0/op/segments/0/type").asText()).isEqualTo("Arc");
        assertThat(tree.at("/nodes/0/op/segments/0/ccw").asBoolean()).isFalse();
        assertThat(tree.at("/nodes/1/op/axis_dir/y").asDouble()).isEqualTo(1.0);
        assertThat(tree.at("/nodes/1/op/angle_deg").asDouble()).isEqualTo(180.0);
    }

    @Test
    void toJson_omitsAbsentSweepOptions() {
        CsgOp.Sketch2D sketch = new CsgOp.Sketch2D(Vec3.ZERO, new Vec3(1, 0, 0), new Vec3(0, 1, 0), List.of());
        Document doc = Document.ofNodes(List.of(
                new Node(0, sketch),
                new Node(1, new CsgOp.Sweep(0, new PathCurve.Line(Vec3.ZERO, new Vec3(0, 0, 10)), 1.5, null, null, 32, null)),
                new Node(2, new CsgOp.Empty())
        ));

        JsonNode tree = DocumentJson.toTree(doc);

        assertThat(tree.at("/nodes/1/op/path/type").asText()).isEqualTo("Line");
        assertThat(tree.at("/nodes/1/op/twist_angle").asDouble()).isEqualTo(1.5);
        assertThat(tree.at("/nodes/1/op/path_segments").asInt()).isEqualTo(32);
        assertThat(tree.at("/nodes/1/op").has("scale_start")).isFalse();
        assertThat(tree.at("/nodes/2/op/type").asText()).isEqualTo("Empty");
        assertThat(DocumentJson.fromJson(DocumentJson.toJson(doc))).isEqualTo(doc);
    }

    @Test
    void fromJson_readsAssemblyDocument() {
        String json = """
                {
                  "version": "0.1",
                  "nodes": {
                    "0": {"id": 0, "name": "base", "op": {"type": "Cube", "size": {"x": 10, "y": 10, "z": 2}}},
                    "1": {"id": 1, "name": null, "op": {"type": "Cylinder", "radius": 1, "height": 8, "segments": 24}},
                    "2": {"id": 2, "name": null, "op": {"type": "Fillet", "child": 0, "radius": 0.5}}
                  },
                  "materials": {
                    "aluminum": {"name": "aluminum", "color": [0.9, 0.9, 0.92], "metallic": 1, "roughness": 0.3, "density": 2700}
                  },
                  "part_materials": {},
                  "roots": [{"root": 2, "material": "aluminum"}, {"root": 1, "material": "aluminum"}],
                  "partDefs": {
                    "plate": {"id": "plate", "root": 2, "defaultMaterial": "aluminum"},
                    "pin": {"id": "pin", "name": "Pin", "root": 1}
                  },
                  "instances": [
                    {"id": "p1", "partDefId": "plate"},
                    {"id": "n1", "partDefId": "pin", "transform": {
                      "translation": {"x": 0, "y": 0, "z": 2},
                      "rotation": {"x": 0, "y": 0, "z": 0},
                      "scale": {"x": 1, "y": 1, "z": 1}}}
                  ],
                  "joints": [
                    {"id": "j1", "parentInstanceId": "p1", "childInstanceId": "n1",
                     "parentAnchor": {"x": 0, "y": 0, "z": 2}, "childAnchor": {"x": 0, "y": 0, "z": 0},
                     "kind": {"type": "Revolute", "axis": {"x": 0, "y": 0, "z": 1}, "limits": [-45, 45]}, "state": 10},
                    {"id": "j0", "parentInstanceId": null, "childInstanceId": "p1",
                     "parentAnchor": {"x": 0, "y": 0, "z": 0}, "childAnchor": {"x": 0, "y": 0, "z": 0},
                     "kind": {"type": "Fixed"}, "state": 0}
                  ],
                  "groundInstanceId": "p1"
                }
                """;

        Document doc = DocumentJson.fromJson(json);

        assertThat(doc.nodes()).containsOnlyKeys(0L, 1L, 2L);
        assertThat(doc.node(0).name()).isEqualTo("base");
        assertThat(doc.node(1).op()).isEqualTo(new CsgOp.Cylinder(1, 8, 24));
        assertThat(doc.node(2).op()).isEqualTo(new CsgOp.Fillet(0, 0.5));
        assertThat(doc.materials().get("aluminum").density()).isEqualTo(2700.0);
        assertThat(doc.materials().get("aluminum").friction()).isNull();
        assertThat(doc.roots()).containsExactly(new SceneEntry(2, "aluminum"), new SceneEntry(1, "aluminum"));
        assertThat(doc.partDefs()).containsOnlyKeys("plate", "pin");
        assertThat(doc.partDefs().get("pin").root()).isEqualTo(1);
        assertThat(doc.instances()).hasSize(2);
        assertThat(doc.instances().get(1).transform().translation()).isEqualTo(new Vec3(0, 0, 2));
        assertThat(doc.joints().get(0).kind())
                .isEqualTo(new JointKind.Revolute(new Vec3(0, 0, 1), List.of(-45.0, 45.0)));
        assertThat(doc.joints().get(1).kind()).isInstanceOf(JointKind.Fixed.class);
        assertThat(doc.joints().get(1).parentInstanceId()).isNull();
        assertThat(doc.groundInstanceId()).isEqualTo("p1");

        assertThat(DocumentJson.fromJson(DocumentJson.toJson(doc))).isEqualTo(doc);
        assertThat(DocumentJson.toTree(doc).at("/joints/1").has("parentInstanceId")).isTrue();
    }

    @Test
    void fromJson_roundTripsSketchSegments() {
        Document doc = Document.ofNodes(List.of(new Node(0, new CsgOp.Sketch2D(Vec3.ZERO, new Vec3(1, 0, 0), new Vec3(0, 1, 0),
                List.of(new SketchSegment2D.Line(new Vec2(0, 0), new Vec2(1, 0)),
                        new SketchSegment2D.Arc(new Vec2(1, 0), new Vec2(0, 1), new Vec2(0, 0), true))))));

        assertThat(DocumentJson.fromJson(DocumentJson.toJson(doc))).isEqualTo(doc);
    }

    @Test
    void fromJson_rejectsMalformedDocuments() {
        assertThatThrownBy(() -> DocumentJson.fromJson("{not json")).isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson("  ")).isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson(
                "{\"nodes\": {\"0\": {\"id\": 0, \"op\": {\"type\": \"Torus\"}}}}"))
                .isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson(
                "{\"nodes\": {\"0\": {\"id\": 5, \"op\": {\"type\": \"Empty\"}}}}"))
                .isInstanceOf(DocumentJsonException.class)
                .hasMessageContaining("不一致");
        assertThatThrownBy(() -> DocumentJson.fromJson(
                "{\"nodes\": {\"0\": {\"id\": 0, \"op\": {\"type\": \"Loft\", \"sketches\": [1]}}}}"))
                .isInstanceOf(DocumentJsonException.class);
    }

    @Test
    void fromJson_rejectsOpsWithMissingRequiredFields() {
        assertThatThrownBy(() -> DocumentJson.fromJson(
                "{\"nodes\": {\"0\": {\"id\": 0, \"op\": {\"type\": \"Cube\"}}}}"))
                .isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson("""
                {"nodes": {"0": {"id": 0, "op": {"type": "Sketch2D",
                  "x_dir": {"x": 1, "y": 0, "z": 0}, "y_dir": {"x": 0, "y": 1, "z": 0}, "segments": []}}}}
                """))
                .isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson("""
                {"nodes": {"0": {"id": 0, "op": {"type": "Sketch2D",
                  "origin": {"x": 0, "y": 0, "z": 0}, "x_dir": {"x": 1, "y": 0, "z": 0}, "y_dir": {"x": 0, "y": 1, "z": 0},
                  "segments": [{"type": "Line", "start": {"x": 0, "y": 0}}]}}}}
                """))
                .isInstanceOf(DocumentJsonException.class);
        assertThatThrownBy(() -> DocumentJson.fromJson(
                "{\"nodes\": {\"0\": {\"id\": 0, \"op\": {\"type\": \"Translate\", \"child\": 1}}}}"))
                .isInstanceOf(DocumentJsonException.class);
    }

    @Test
    void fromJson_defaultsMissingCollections() {
        Document doc = DocumentJson.fromJson("{\"version\": \"0.3\", \"nodes\": {}}");

        assertThat(doc.version()).isEqualTo("0.3");
        assertThat(doc.nodes()).isEmpty();
        assertThat(doc.materials()).isEmpty();
        assertThat(doc.roots()).isEmpty();
        assertThat(doc.instances()).isNull();
    }
}
