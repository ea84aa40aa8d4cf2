package org.vcad.ir;

/**
 * 装配模式下可复用的零件定义。
 *
 * @param id              零件定义 id
 * @param name            显示名称（可选）
 * @param root            零件几何对应的根节点 id
 * @param defaultMaterial 默认材质键（可选）
 */
public record PartDef(String id, String name, long root, String defaultMaterial) {
}
