package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * 扫掠（Sweep）使用的路径曲线。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PathCurve.Line.class, name = "Line"),
        @JsonSubTypes.Type(value = PathCurve.Helix.class, name = "Helix")
})
public sealed interface PathCurve {

    record Line(Vec3 start, Vec3 end) implements PathCurve {

        public Line {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }
    }

    /**
     * 绕 z 轴的螺旋线。
     */
    record Helix(double radius, double pitch, double height, double turns) implements PathCurve {
    }
}
