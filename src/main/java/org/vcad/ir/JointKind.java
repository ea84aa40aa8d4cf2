package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * 装配关节类型。limits 为 [min, max]，可选。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JointKind.Fixed.class, name = "Fixed"),
        @JsonSubTypes.Type(value = JointKind.Revolute.class, name = "Revolute"),
        @JsonSubTypes.Type(value = JointKind.Slider.class, name = "Slider"),
        @JsonSubTypes.Type(value = JointKind.Cylindrical.class, name = "Cylindrical"),
        @JsonSubTypes.Type(value = JointKind.Ball.class, name = "Ball")
})
public sealed interface JointKind {

    record Fixed() implements JointKind {
    }

    record Revolute(Vec3 axis, List<Double> limits) implements JointKind {
    }

    record Slider(Vec3 axis, List<Double> limits) implements JointKind {
    }

    record Cylindrical(Vec3 axis) implements JointKind {
    }

    record Ball() implements JointKind {
    }
}
