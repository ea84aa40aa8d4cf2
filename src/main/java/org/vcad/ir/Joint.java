package org.vcad.ir;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 连接两个实例的关节。
 *
 * @param id               关节 id
 * @param name             显示名称（可选）
 * @param parentInstanceId 父实例 id；为 null 表示连接到世界坐标系
 * @param childInstanceId  子实例 id
 * @param parentAnchor     父实例上的锚点
 * @param childAnchor      子实例上的锚点
 * @param kind             关节类型
 * @param state            当前关节状态（角度或位移）
 */
public record Joint(
        String id,
        String name,
        @JsonInclude(JsonInclude.Include.ALWAYS) String parentInstanceId,
        String childInstanceId,
        Vec3 parentAnchor,
        Vec3 childAnchor,
        JointKind kind,
        double state
) {
}
