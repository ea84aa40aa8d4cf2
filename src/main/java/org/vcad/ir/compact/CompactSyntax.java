package org.vcad.ir.compact;

/**
 * Compact IR 的固定记号。
 */
public final class CompactSyntax {

    private CompactSyntax() {
    }

    /** 注释行前缀，注释行不分配节点 id */
    public static final String COMMENT_PREFIX = "#";

    /** 草图块结束行 */
    public static final String END = "END";

    /** v0.2 场景根声明：{@code ROOT <id> <material>} */
    public static final String ROOT = "ROOT";

    public static final int ROOT_ARITY = 2;

    /** v0.2 文本的首行版本注释 */
    public static final String VERSION_HEADER = "# vcad 0.2";
}
