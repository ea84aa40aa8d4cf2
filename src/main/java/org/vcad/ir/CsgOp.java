package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * 文档节点上的操作（封闭的带标签联合）。
 * <p>
 * 分类：
 * <ul>
 *   <li>叶子：{@link Cube}/{@link Cylinder}/{@link Sphere}/{@link Cone}/{@link Empty}/{@link ImportedMesh}</li>
 *   <li>一元：{@link Translate}/{@link Rotate}/{@link Scale}/{@link LinearPattern}/{@link CircularPattern}/
 *   {@link Shell}/{@link Fillet}/{@link Chamfer}，各自引用一个 child</li>
 *   <li>二元：{@link Union}/{@link Difference}/{@link Intersection}</li>
 *   <li>草图消费者：{@link Extrude}/{@link Revolve}/{@link Sweep}/{@link Loft}，引用的节点必须是 {@link Sketch2D}</li>
 * </ul>
 * JSON 中以 {@code type} 字段区分具体类型，字段名沿用文档格式里的 snake_case。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CsgOp.Cube.class, name = "Cube"),
        @JsonSubTypes.Type(value = CsgOp.Cylinder.class, name = "Cylinder"),
        @JsonSubTypes.Type(value = CsgOp.Sphere.class, name = "Sphere"),
        @JsonSubTypes.Type(value = CsgOp.Cone.class, name = "Cone"),
        @JsonSubTypes.Type(value = CsgOp.Empty.class, name = "Empty"),
        @JsonSubTypes.Type(value = CsgOp.ImportedMesh.class, name = "ImportedMesh"),
        @JsonSubTypes.Type(value = CsgOp.Union.class, name = "Union"),
        @JsonSubTypes.Type(value = CsgOp.Difference.class, name = "Difference"),
        @JsonSubTypes.Type(value = CsgOp.Intersection.class, name = "Intersection"),
        @JsonSubTypes.Type(value = CsgOp.Translate.class, name = "Translate"),
        @JsonSubTypes.Type(value = CsgOp.Rotate.class, name = "Rotate"),
        @JsonSubTypes.Type(value = CsgOp.Scale.class, name = "Scale"),
        @JsonSubTypes.Type(value = CsgOp.LinearPattern.class, name = "LinearPattern"),
        @JsonSubTypes.Type(value = CsgOp.CircularPattern.class, name = "CircularPattern"),
        @JsonSubTypes.Type(value = CsgOp.Shell.class, name = "Shell"),
        @JsonSubTypes.Type(value = CsgOp.Fillet.class, name = "Fillet"),
        @JsonSubTypes.Type(value = CsgOp.Chamfer.class, name = "Chamfer"),
        @JsonSubTypes.Type(value = CsgOp.Sketch2D.class, name = "Sketch2D"),
        @JsonSubTypes.Type(value = CsgOp.Extrude.class, name = "Extrude"),
        @JsonSubTypes.Type(value = CsgOp.Revolve.class, name = "Revolve"),
        @JsonSubTypes.Type(value = CsgOp.Sweep.class, name = "Sweep"),
        @JsonSubTypes.Type(value = CsgOp.Loft.class, name = "Loft")
})
public sealed interface CsgOp {

    /**
     * 该操作引用的全部子节点 id（按字段顺序）。
     */
    default List<Long> children() {
        return List.of();
    }

    /**
     * {@link #children()} 中必须指向 {@link Sketch2D} 的那部分。
     */
    default List<Long> sketchInputs() {
        return List.of();
    }

    /**
     * 与 JSON {@code type} 字段一致的类型名。
     */
    default String typeName() {
        return getClass().getSimpleName();
    }

    // ---------------- 叶子 ----------------

    record Cube(Vec3 size) implements CsgOp {

        public Cube {
            Objects.requireNonNull(size, "size");
        }
    }

    /**
     * @param segments 网格细分段数，0 表示由求值器自动决定
     */
    record Cylinder(double radius, double height, int segments) implements CsgOp {
    }

    record Sphere(double radius, int segments) implements CsgOp {
    }

    record Cone(
            @JsonProperty("radius_bottom") double radiusBottom,
            @JsonProperty("radius_top") double radiusTop,
            double height,
            int segments
    ) implements CsgOp {
    }

    /**
     * 空几何（占位节点）。
     */
    record Empty() implements CsgOp {
    }

    /**
     * 外部导入的三角网格。
     *
     * @param positions 顶点坐标，按 xyz 平铺
     * @param indices   三角形索引
     * @param normals   顶点法线（可选）
     * @param source    来源文件名（可选）
     */
    record ImportedMesh(
            List<Double> positions,
            List<Long> indices,
            List<Double> normals,
            String source
    ) implements CsgOp {

        public ImportedMesh {
            positions = positions == null ? List.of() : List.copyOf(positions);
            indices = indices == null ? List.of() : List.copyOf(indices);
            normals = normals == null ? null : List.copyOf(normals);
        }
    }

    // ---------------- 二元布尔 ----------------

    record Union(long left, long right) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(left, right);
        }
    }

    record Difference(long left, long right) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(left, right);
        }
    }

    record Intersection(long left, long right) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(left, right);
        }
    }

    // ---------------- 一元 ----------------

    record Translate(long child, Vec3 offset) implements CsgOp {

        public Translate {
            Objects.requireNonNull(offset, "offset");
        }

        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    /**
     * @param angles 绕 x/y/z 轴的旋转角（度）
     */
    record Rotate(long child, Vec3 angles) implements CsgOp {

        public Rotate {
            Objects.requireNonNull(angles, "angles");
        }

        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record Scale(long child, Vec3 factor) implements CsgOp {

        public Scale {
            Objects.requireNonNull(factor, "factor");
        }

        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record LinearPattern(long child, Vec3 direction, long count, double spacing) implements CsgOp {

        public LinearPattern {
            Objects.requireNonNull(direction, "direction");
        }

        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record CircularPattern(
            long child,
            @JsonProperty("axis_origin") Vec3 axisOrigin,
            @JsonProperty("axis_dir") Vec3 axisDir,
            long count,
            @JsonProperty("angle_deg") double angleDeg
    ) implements CsgOp {

        public CircularPattern {
            Objects.requireNonNull(axisOrigin, "axis_origin");
            Objects.requireNonNull(axisDir, "axis_dir");
        }

        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record Shell(long child, double thickness) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record Fillet(long child, double radius) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    record Chamfer(long child, double distance) implements CsgOp {
        @Override
        public List<Long> children() {
            return List.of(child);
        }
    }

    // ---------------- 草图与草图消费者 ----------------

    /**
     * 位于 origin 处、由 x_dir/y_dir 张成的平面上的二维轮廓。
     */
    record Sketch2D(
            Vec3 origin,
            @JsonProperty("x_dir") Vec3 xDir,
            @JsonProperty("y_dir") Vec3 yDir,
            List<SketchSegment2D> segments
    ) implements CsgOp {

        public Sketch2D {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(xDir, "x_dir");
            Objects.requireNonNull(yDir, "y_dir");
            segments = segments == null ? List.of() : List.copyOf(segments);
        }
    }

    record Extrude(long sketch, Vec3 direction) implements CsgOp {

        public Extrude {
            Objects.requireNonNull(direction, "direction");
        }

        @Override
        public List<Long> children() {
            return List.of(sketch);
        }

        @Override
        public List<Long> sketchInputs() {
            return List.of(sketch);
        }
    }

    record Revolve(
            long sketch,
            @JsonProperty("axis_origin") Vec3 axisOrigin,
            @JsonProperty("axis_dir") Vec3 axisDir,
            @JsonProperty("angle_deg") double angleDeg
    ) implements CsgOp {

        public Revolve {
            Objects.requireNonNull(axisOrigin, "axis_origin");
            Objects.requireNonNull(axisDir, "axis_dir");
        }

        @Override
        public List<Long> children() {
            return List.of(sketch);
        }

        @Override
        public List<Long> sketchInputs() {
            return List.of(sketch);
        }
    }

    /**
     * 沿路径扫掠草图。可选参数为 null 时由求值器取默认值
     * （twist 0、scale 1.0、path_segments 自动、arc_segments 8）。
     *
     * @param twistAngle 总扭转角（弧度）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Sweep(
            long sketch,
            PathCurve path,
            @JsonProperty("twist_angle") Double twistAngle,
            @JsonProperty("scale_start") Double scaleStart,
            @JsonProperty("scale_end") Double scaleEnd,
            @JsonProperty("path_segments") Integer pathSegments,
            @JsonProperty("arc_segments") Integer arcSegments
    ) implements CsgOp {

        public Sweep {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public List<Long> children() {
            return List.of(sketch);
        }

        @Override
        public List<Long> sketchInputs() {
            return List.of(sketch);
        }
    }

    /**
     * 在多个草图截面之间放样，至少需要两个截面。
     *
     * @param closed 是否首尾相连形成管状（可选）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Loft(List<Long> sketches, Boolean closed) implements CsgOp {

        public Loft {
            sketches = sketches == null ? List.of() : List.copyOf(sketches);
            if (sketches.size() < 2) {
                throw new IllegalArgumentException("Loft 至少需要 2 个草图，实际 " + sketches.size() + " 个");
            }
        }

        @Override
        public List<Long> children() {
            return sketches;
        }

        @Override
        public List<Long> sketchInputs() {
            return sketches;
        }
    }
}
