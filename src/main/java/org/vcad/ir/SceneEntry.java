package org.vcad.ir;

/**
 * 场景中的一个可见根：节点 + 材质键。
 *
 * @param root     根节点 id
 * @param material {@link Document#materials()} 中的材质键
 */
public record SceneEntry(long root, String material) {
}
