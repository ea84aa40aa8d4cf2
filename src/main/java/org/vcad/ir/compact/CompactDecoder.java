package org.vcad.ir.compact;

import org.vcad.ir.CsgOp;
import org.vcad.ir.Document;
import org.vcad.ir.MaterialDef;
import org.vcad.ir.Node;
import org.vcad.ir.SceneEntry;
import org.vcad.ir.SketchSegment2D;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compact IR 文本 → {@link Document}。
 * <p>
 * 规则：
 * <ul>
 *   <li>每条产生节点的有效行分配一个 id，从 0 开始连续递增；空行、注释行、{@code ROOT} 行不分配 id。</li>
 *   <li>草图块（{@code SK} … {@code END}）整体只占一个 id。</li>
 *   <li>子节点引用必须指向已定义的节点，因此解码结果天然无环。</li>
 *   <li>任何一行出错都会抛出 {@link CompactParseException}，不返回部分结果。</li>
 * </ul>
 */
final class CompactDecoder {

    private CompactDecoder() {
    }

    static Document decode(String input, CompactDecodeOptions options) {
        if (input == null) {
            throw new IllegalArgumentException("input 不能为空");
        }
        if (options.maxInputChars() > 0 && input.length() > options.maxInputChars()) {
            throw new CompactParseException(0,
                    "输入过长：" + input.length() + " 个字符，上限 " + options.maxInputChars());
        }

        CompactLineScanner scanner = new CompactLineScanner(input);
        Map<Long, Node> nodes = new TreeMap<>();
        List<SceneEntry> declaredRoots = new ArrayList<>();
        long nextId = 0;

        CompactLineScanner.ScannedLine line;
        while ((line = scanner.next()) != null) {
            String token = line.opcode();
            if (CompactSyntax.ROOT.equals(token)) {
                declaredRoots.add(parseRoot(line, nodes));
                continue;
            }
            if (CompactSyntax.END.equals(token)) {
                throw new CompactParseException(line.line(), "END 没有对应的 SK 草图块");
            }
            Opcode opcode = Opcode.fromToken(token);
            if (opcode == null) {
                throw new CompactParseException(line.line(), "未知的操作码：" + token);
            }

            CompactArgs args = CompactArgs.of(line, opcode.arity());
            if (opcode.block()) {
                args = args.withBlock(readSegments(scanner, line));
            }
            CsgOp op = opcode.build(args);
            checkReferences(op, nodes, line);

            nodes.put(nextId, new Node(nextId, op));
            nextId++;
        }

        if (nodes.isEmpty()) {
            return Document.empty();
        }
        List<SceneEntry> roots = declaredRoots.isEmpty()
                ? RootInference.infer(nodes, options.rootMode())
                : declaredRoots;
        return new Document(nodes, materialsFor(roots), roots);
    }

    private static List<SketchSegment2D> readSegments(CompactLineScanner scanner,
                                                      CompactLineScanner.ScannedLine header) {
        List<SketchSegment2D> segments = new ArrayList<>();
        CompactLineScanner.ScannedLine line;
        while ((line = scanner.next()) != null) {
            if (CompactSyntax.END.equals(line.opcode())) {
                if (line.argCount() != 0) {
                    throw new CompactParseException(line.line(), "END 不接受参数");
                }
                return segments;
            }
            SegmentOpcode segment = SegmentOpcode.fromToken(line.opcode());
            if (segment == null) {
                throw new CompactParseException(line.line(), "草图块内只允许 L/A 段，遇到：" + line.opcode());
            }
            segments.add(segment.build(CompactArgs.of(line, segment.arity())));
        }
        throw new CompactParseException(header.line(), "SK 草图块缺少 END");
    }

    private static void checkReferences(CsgOp op, Map<Long, Node> nodes, CompactLineScanner.ScannedLine line) {
        for (Long child : op.children()) {
            if (!nodes.containsKey(child)) {
                throw new CompactParseException(line.line(), "引用了未定义的节点 " + child);
            }
        }
        for (Long input : op.sketchInputs()) {
            CsgOp target = nodes.get(input).op();
            if (!(target instanceof CsgOp.Sketch2D)) {
                throw new CompactParseException(line.line(),
                        line.opcode() + " 的输入 " + input + " 必须是 SK 草图，实际是 " + target.typeName());
            }
        }
    }

    private static SceneEntry parseRoot(CompactLineScanner.ScannedLine line, Map<Long, Node> nodes) {
        CompactArgs args = CompactArgs.of(line, CompactSyntax.ROOT_ARITY);
        long root = args.nodeRef(0);
        if (!nodes.containsKey(root)) {
            throw args.error("ROOT 引用了未定义的节点 " + root);
        }
        return new SceneEntry(root, args.word(1));
    }

    private static Map<String, MaterialDef> materialsFor(List<SceneEntry> roots) {
        Map<String, MaterialDef> materials = new LinkedHashMap<>();
        for (SceneEntry entry : roots) {
            materials.computeIfAbsent(entry.material(), MaterialDef::grey);
        }
        return materials;
    }
}
