package org.vcad.ir;

/**
 * 装配实例的位姿：平移、旋转（角度制）与缩放。
 *
 * @param translation 平移
 * @param rotation    绕 x/y/z 轴的旋转角（度）
 * @param scale       缩放
 */
public record Transform3D(Vec3 translation, Vec3 rotation, Vec3 scale) {

    public static Transform3D identity() {
        return new Transform3D(Vec3.ZERO, Vec3.ZERO, Vec3.ONE);
    }
}
