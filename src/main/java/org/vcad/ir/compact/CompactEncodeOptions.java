package org.vcad.ir.compact;

/**
 * 编码选项。
 *
 * @param versionHeader 是否在首行输出 {@code # vcad 0.2}
 * @param sceneRoots    是否在末尾为文档的每个场景根输出 {@code ROOT <id> <material>}
 */
public record CompactEncodeOptions(boolean versionHeader, boolean sceneRoots) {

    public static CompactEncodeOptions defaults() {
        return new CompactEncodeOptions(false, false);
    }

    /**
     * v0.2 格式：带版本头，并保留多根场景。
     */
    public static CompactEncodeOptions v02() {
        return new CompactEncodeOptions(true, true);
    }
}
