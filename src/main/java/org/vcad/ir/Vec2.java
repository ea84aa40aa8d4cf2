package org.vcad.ir;

/**
 * 草图平面内的二维坐标。
 */
public record Vec2(double x, double y) {
}
