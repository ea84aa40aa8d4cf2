package org.vcad.ir;

/**
 * 三维向量（位置、方向、缩放系数共用）。
 */
public record Vec3(double x, double y, double z) {

    public static final Vec3 ZERO = new Vec3(0, 0, 0);

    public static final Vec3 ONE = new Vec3(1, 1, 1);
}
