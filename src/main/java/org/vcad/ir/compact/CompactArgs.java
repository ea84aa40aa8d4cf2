package org.vcad.ir.compact;

import org.vcad.ir.SketchSegment2D;
import org.vcad.ir.Vec2;
import org.vcad.ir.Vec3;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 一行指令的参数访问器（索引从 0 开始，不含操作码本身）。
 * <p>
 * 数值解析是严格的：非数字、NaN/Infinity、十六进制、带类型后缀（如 {@code 1f}）的记号都会直接报错，
 * 不会被静默转换成 NaN 写进文档。
 */
final class CompactArgs {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern UNSIGNED = Pattern.compile("\\d+");

    private final CompactLineScanner.ScannedLine line;
    private final List<SketchSegment2D> block;

    private CompactArgs(CompactLineScanner.ScannedLine line, List<SketchSegment2D> block) {
        this.line = line;
        this.block = block;
    }

    /**
     * 校验参数个数并创建访问器。
     */
    static CompactArgs of(CompactLineScanner.ScannedLine line, int arity) {
        if (line.argCount() != arity) {
            throw new CompactParseException(line.line(),
                    line.opcode() + " 需要 " + arity + " 个参数，实际 " + line.argCount() + " 个");
        }
        return new CompactArgs(line, List.of());
    }

    CompactArgs withBlock(List<SketchSegment2D> segments) {
        return new CompactArgs(line, List.copyOf(segments));
    }

    int line() {
        return line.line();
    }

    List<SketchSegment2D> block() {
        return block;
    }

    double number(int index) {
        String token = token(index);
        if (!NUMBER.matcher(token).matches()) {
            throw error("无效的数字：" + token);
        }
        double value = Double.parseDouble(token);
        if (!Double.isFinite(value)) {
            throw error("数值超出范围：" + token);
        }
        return value;
    }

    Vec2 vec2(int index) {
        return new Vec2(number(index), number(index + 1));
    }

    Vec3 vec3(int index) {
        return new Vec3(number(index), number(index + 1), number(index + 2));
    }

    /**
     * 节点引用：非负整数。是否指向已定义节点由解码器检查。
     */
    long nodeRef(int index) {
        return unsigned(index, "无效的节点 id：");
    }

    long count(int index) {
        return unsigned(index, "无效的数量（需要非负整数）：");
    }

    boolean flag(int index) {
        String token = token(index);
        if ("1".equals(token)) {
            return true;
        }
        if ("0".equals(token)) {
            return false;
        }
        throw error("无效的标志位（只能是 0 或 1）：" + token);
    }

    String word(int index) {
        return token(index);
    }

    CompactParseException error(String detail) {
        return new CompactParseException(line.line(), detail);
    }

    private long unsigned(int index, String message) {
        String token = token(index);
        if (!UNSIGNED.matcher(token).matches()) {
            throw error(message + token);
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw error(message + token);
        }
    }

    private String token(int index) {
        return line.tokens()[index + 1];
    }
}
