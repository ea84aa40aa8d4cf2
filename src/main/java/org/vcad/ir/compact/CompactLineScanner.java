package org.vcad.ir.compact;

/**
 * 按行扫描 Compact IR 文本，跳过空行与注释行。
 * <p>
 * 游标只前进不后退；草图块直接复用同一个扫描器继续读取段行。
 */
final class CompactLineScanner {

    /**
     * 一行有效内容。
     *
     * @param line   物理行号（从 0 开始）
     * @param text   去掉首尾空白后的文本
     * @param tokens 按空白切分后的记号，第一个为操作码
     */
    record ScannedLine(int line, String text, String[] tokens) {

        String opcode() {
            return tokens[0];
        }

        int argCount() {
            return tokens.length - 1;
        }
    }

    private final String[] lines;
    private int cursor;

    CompactLineScanner(String input) {
        // 按 \n 切分后 trim，\r\n 输入同样适用
        this.lines = input.split("\n", -1);
    }

    /**
     * 下一条有效行；到达末尾时返回 null。
     */
    ScannedLine next() {
        while (cursor < lines.length) {
            int index = cursor++;
            String text = lines[index].trim();
            if (text.isEmpty() || text.startsWith(CompactSyntax.COMMENT_PREFIX)) {
                continue;
            }
            return new ScannedLine(index, text, text.split("\\s+"));
        }
        return null;
    }
}
