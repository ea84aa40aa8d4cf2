package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * 草图轮廓中的一段：直线或圆弧。段本身不引用任何节点。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SketchSegment2D.Line.class, name = "Line"),
        @JsonSubTypes.Type(value = SketchSegment2D.Arc.class, name = "Arc")
})
public sealed interface SketchSegment2D {

    Vec2 start();

    Vec2 end();

    record Line(Vec2 start, Vec2 end) implements SketchSegment2D {

        public Line {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }
    }

    /**
     * @param center 圆心
     * @param ccw    是否逆时针
     */
    record Arc(Vec2 start, Vec2 end, Vec2 center, boolean ccw) implements SketchSegment2D {

        public Arc {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            Objects.requireNonNull(center, "center");
        }
    }
}
