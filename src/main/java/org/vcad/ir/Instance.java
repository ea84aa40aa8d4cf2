package org.vcad.ir;

/**
 * 零件定义在装配中的一个实例。
 *
 * @param id        实例 id
 * @param partDefId 引用的 {@link PartDef#id()}
 * @param name      显示名称（可选）
 * @param transform 实例位姿（可选，缺省为单位变换）
 * @param material  覆盖材质键（可选）
 */
public record Instance(String id, String partDefId, String name, Transform3D transform, String material) {
}
