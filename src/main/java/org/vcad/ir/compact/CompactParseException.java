package org.vcad.ir.compact;

/**
 * Compact IR 解析失败。
 * <p>
 * 解析是全有或全无的：出现该异常时不会返回任何部分结果。
 * {@link #getLine()} 为出错的物理行号（从 0 开始，包含空行与注释行）。
 */
public class CompactParseException extends RuntimeException {

    private final int line;
    private final String detail;

    public CompactParseException(int line, String detail) {
        super(String.format("第 %d 行: %s", line, detail));
        this.line = line;
        this.detail = detail;
    }

    public int getLine() {
        return line;
    }

    public String getDetail() {
        return detail;
    }
}
