package org.vcad.ir;

import java.util.List;

/**
 * PBR 材质定义。
 *
 * @param name      材质名称
 * @param color     线性 RGB，三个分量均在 [0, 1]
 * @param metallic  金属度
 * @param roughness 粗糙度
 * @param density   密度（kg/m³，可选，仅物理仿真使用）
 * @param friction  摩擦系数（可选）
 */
public record MaterialDef(
        String name,
        List<Double> color,
        double metallic,
        double roughness,
        Double density,
        Double friction
) {

    public static final String DEFAULT_KEY = "default";

    public MaterialDef {
        color = color == null ? List.of() : List.copyOf(color);
    }

    /**
     * 解码 Compact IR 时为场景根自动补充的灰色材质。
     */
    public static MaterialDef grey(String name) {
        return new MaterialDef(name, List.of(0.8, 0.8, 0.8), 0.0, 0.5, null, null);
    }
}
