package org.vcad.ir.compact;

import org.vcad.ir.Vec2;
import org.vcad.ir.Vec3;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 逐行拼接 Compact IR 文本。
 * <p>
 * 节点引用通过 {@link #ref(long)} 写出，会自动替换成重编号后的 id。
 * 行之间用 {@code \n} 分隔，末尾不带换行。
 */
final class CompactLineWriter {

    private final StringBuilder out = new StringBuilder();
    private final Map<Long, Integer> remap;
    private int lineCount;

    CompactLineWriter(Map<Long, Integer> remap) {
        this.remap = remap;
    }

    CompactLineWriter line(String token) {
        if (lineCount++ > 0) {
            out.append('\n');
        }
        out.append(token);
        return this;
    }

    CompactLineWriter ref(long originalId) {
        Integer mapped = remap.get(originalId);
        if (mapped == null) {
            throw new IllegalStateException("节点 " + originalId + " 未参与排序");
        }
        out.append(' ').append(mapped);
        return this;
    }

    CompactLineWriter num(double value) {
        out.append(' ').append(formatNumber(value));
        return this;
    }

    CompactLineWriter vec2(Vec2 v) {
        return num(v.x()).num(v.y());
    }

    CompactLineWriter vec3(Vec3 v) {
        return num(v.x()).num(v.y()).num(v.z());
    }

    CompactLineWriter count(long value) {
        out.append(' ').append(value);
        return this;
    }

    CompactLineWriter flag(boolean value) {
        out.append(' ').append(value ? '1' : '0');
        return this;
    }

    CompactLineWriter word(String value) {
        out.append(' ').append(value);
        return this;
    }

    /**
     * 额外空一格，用于草图头部三组向量之间的分隔。
     */
    CompactLineWriter gap() {
        out.append(' ');
        return this;
    }

    int lineCount() {
        return lineCount;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    /**
     * 数值的最短书写形式：整数不带小数点，其余用最短的十进制表示；
     * 绝对值不在 [1e-6, 1e21) 内时才使用指数形式。
     */
    static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            throw new CompactEncodeException("无法编码非有限数值：" + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        double abs = Math.abs(value);
        if (abs >= 1e-6 && abs < 1e21) {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
        return Double.toString(value);
    }
}
