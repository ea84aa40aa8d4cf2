package org.vcad.ir.compact;

/**
 * 解码时没有显式 {@code ROOT} 行时的根推断方式。
 */
public enum RootMode {

    /** 只取一个根：id 最大的未引用节点（最后定义的那个）。 */
    SINGLE,

    /** 所有未引用节点按 id 升序都作为场景根。 */
    ALL_UNREFERENCED
}
