package org.vcad.ir.compact;

import java.util.Objects;

/**
 * 解码选项。
 *
 * @param rootMode      根推断方式
 * @param maxInputChars 输入最大字符数，0 表示不限制
 */
public record CompactDecodeOptions(RootMode rootMode, long maxInputChars) {

    public CompactDecodeOptions {
        Objects.requireNonNull(rootMode, "rootMode");
        if (maxInputChars < 0) {
            throw new IllegalArgumentException("maxInputChars 不能为负数：" + maxInputChars);
        }
    }

    public static CompactDecodeOptions defaults() {
        return new CompactDecodeOptions(RootMode.SINGLE, 0);
    }

    public CompactDecodeOptions withRootMode(RootMode mode) {
        return new CompactDecodeOptions(mode, maxInputChars);
    }
}
