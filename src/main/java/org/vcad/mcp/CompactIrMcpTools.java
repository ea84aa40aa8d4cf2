package org.vcad.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.vcad.config.CompactIrProperties;
import org.vcad.ir.Document;
import org.vcad.ir.compact.CompactDecodeOptions;
import org.vcad.ir.compact.CompactEncodeException;
import org.vcad.ir.compact.CompactEncodeOptions;
import org.vcad.ir.compact.CompactIr;
import org.vcad.ir.compact.CompactParseException;
import org.vcad.ir.compact.CompactValidator;
import org.vcad.ir.compact.RootMode;
import org.vcad.ir.graph.GraphAnalyzer;
import org.vcad.ir.graph.GraphException;
import org.vcad.ir.graph.GraphReferences;
import org.vcad.ir.json.DocumentJson;
import org.vcad.mcp.dto.CompactDecodeResult;
import org.vcad.mcp.dto.CompactEncodeResult;
import org.vcad.mcp.dto.CompactValidationResult;
import org.vcad.mcp.dto.GraphSummaryResult;
import org.vcad.mcp.dto.ShareUrlResult;
import org.vcad.share.ShareUrlBuilder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compact IR 相关的 MCP 工具集合。
 * <p>
 * 设计要点：
 * <ul>
 *   <li>工具只做参数解析、体积限制与结果组装，编解码逻辑全部在 {@code org.vcad.ir} 中。</li>
 *   <li>文档参数既可以是 JSON（以 '{' 开头），也可以是 Compact IR 文本。</li>
 *   <li>参数错误抛 {@link IllegalArgumentException}，解析/编码错误原样抛出，由 Spring AI 转换为工具错误返回给调用方；
 *       错误信息带行号，调用方可以直接据此修改文本。</li>
 * </ul>
 */
@Component
public class CompactIrMcpTools {

    private static final Logger log = LoggerFactory.getLogger(CompactIrMcpTools.class);

    private static final String FORMAT_JSON = "json";
    private static final String FORMAT_COMPACT = "compact";

    private final CompactIrProperties properties;
    private final ShareUrlBuilder shareUrlBuilder;

    public CompactIrMcpTools(CompactIrProperties properties, ShareUrlBuilder shareUrlBuilder) {
        this.properties = properties;
        this.shareUrlBuilder = shareUrlBuilder;
    }

    @Tool(
            name = "ir_parse_compact",
            description = "把 Compact IR 文本解析为 vcad 文档 JSON（节点 id 从 0 连续编号；默认推断唯一的根，rootMode=ALL_UNREFERENCED 时所有未引用节点都作为根）。"
    )
    public CompactDecodeResult parseCompact(
            @ToolParam(description = "Compact IR 文本，每行一条指令，例如 \"C 50 30 5\\nY 5 10\\nT 1 25 15 0\\nD 0 2\"") String compact,
            @ToolParam(required = false, description = "根推断方式：SINGLE（默认）或 ALL_UNREFERENCED") String rootMode
    ) {
        requireInput(compact, "compact");
        RootMode mode = resolveRootMode(rootMode);

        Document document;
        try {
            document = CompactIr.fromCompact(compact, decodeOptions(mode));
        } catch (CompactParseException e) {
            log.warn("ir_parse_compact 解析失败：{}", e.getMessage());
            throw e;
        }

        List<String> warnings = new ArrayList<>();
        int unreferenced = GraphReferences.unreferenced(document.nodes()).size();
        if (unreferenced > document.roots().size()) {
            warnings.add("有 " + unreferenced + " 个未被引用的节点，但只有 " + document.roots().size()
                    + " 个作为场景根；如需保留全部，请使用 rootMode=ALL_UNREFERENCED。");
        }
        log.info("ir_parse_compact: nodes={}, roots={}, rootMode={}",
                document.nodes().size(), document.roots().size(), mode);
        return new CompactDecodeResult(
                document.nodes().size(),
                document.roots(),
                DocumentJson.toTree(document),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "ir_to_compact",
            description = "把 vcad 文档 JSON 编码为 Compact IR 文本（拓扑排序后按输出顺序重新编号；Sweep/Loft/ImportedMesh 不支持）。"
    )
    public CompactEncodeResult toCompact(
            @ToolParam(description = "vcad 文档 JSON") String document,
            @ToolParam(required = false, description = "是否输出 \"# vcad 0.2\" 版本头（默认取服务端配置）") Boolean versionHeader,
            @ToolParam(required = false, description = "是否为每个场景根输出 \"ROOT <id> <material>\" 行，用于保留多根场景（默认 false）") Boolean sceneRoots
    ) {
        requireInput(document, "document");
        Document doc = DocumentJson.fromJson(document);

        boolean header = versionHeader != null ? versionHeader : properties.isVersionHeader();
        boolean roots = sceneRoots != null && sceneRoots;
        String compact = CompactIr.toCompact(doc, new CompactEncodeOptions(header, roots));

        List<String> warnings = new ArrayList<>();
        if (!roots && doc.roots().size() > 1) {
            warnings.add("文档有 " + doc.roots().size() + " 个场景根，未输出 ROOT 行时重新解析只会推断出一个根；可设置 sceneRoots=true。");
        }
        int lineCount = compact.isEmpty() ? 0 : (int) compact.chars().filter(c -> c == '\n').count() + 1;
        log.info("ir_to_compact: nodes={}, lines={}, chars={}", doc.nodes().size(), lineCount, compact.length());
        return new CompactEncodeResult(
                compact,
                lineCount,
                doc.nodes().size(),
                compact.length(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "ir_validate_compact",
            description = "校验 Compact IR 文本：返回 valid 以及错误码 parse_error/empty_document/no_roots 和出错行号（不抛异常）。"
    )
    public CompactValidationResult validateCompact(
            @ToolParam(description = "Compact IR 文本") String compact
    ) {
        requireInput(compact, "compact");
        CompactValidator.Result result = CompactValidator.validate(compact, decodeOptions(properties.getDefaultRootMode()));
        if (!result.valid()) {
            log.info("ir_validate_compact: {} {}", result.failure().code(), result.message());
        }
        return new CompactValidationResult(
                result.valid(),
                result.valid() ? null : result.failure().code(),
                result.message(),
                result.line(),
                result.document() == null ? null : result.document().nodes().size()
        );
    }

    @Tool(
            name = "ir_inspect_document",
            description = "分析文档结构（JSON 或 Compact IR）：节点类型统计、根、未引用节点、最大深度、悬空引用、环与装配引用问题。"
    )
    public GraphSummaryResult inspectDocument(
            @ToolParam(description = "vcad 文档：JSON（以 '{' 开头）或 Compact IR 文本") String document
    ) {
        requireInput(document, "document");
        String format = detectFormat(document);
        Document doc = readDocument(document, format);
        GraphAnalyzer.Analysis analysis = GraphAnalyzer.analyze(doc);

        List<String> warnings = new ArrayList<>(analysis.warnings());
        boolean encodable = false;
        if (analysis.structurallyValid()) {
            try {
                CompactIr.toCompact(doc);
                encodable = true;
            } catch (CompactEncodeException | GraphException e) {
                warnings.add("无法编码为 Compact IR：" + e.getMessage());
            }
        }

        List<String> dangling = new ArrayList<>();
        for (GraphAnalyzer.DanglingRef ref : analysis.danglingReferences()) {
            dangling.add(ref.nodeId() + " -> " + ref.missingId());
        }
        log.debug("ir_inspect_document: format={}, nodes={}, warnings={}", format, analysis.nodeCount(), warnings.size());
        return new GraphSummaryResult(
                format,
                analysis.nodeCount(),
                analysis.opCounts(),
                analysis.sceneRoots(),
                analysis.unreferenced(),
                analysis.maxDepth(),
                dangling.isEmpty() ? null : dangling,
                analysis.cycleNodeId(),
                encodable,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "ir_share_url",
            description = "生成可在 vcad Web 应用中打开的分享链接（文档转 Compact IR 后 gzip + base64url 编码；链接过长时给出提示）。"
    )
    public ShareUrlResult shareUrl(
            @ToolParam(description = "vcad 文档：JSON（以 '{' 开头）或 Compact IR 文本") String document,
            @ToolParam(required = false, description = "文档名称（可选，显示在 Web 应用中）") String name
    ) {
        requireInput(document, "document");
        Document doc = readDocument(document, detectFormat(document));
        String compact = CompactIr.toCompact(doc);
        ShareUrlBuilder.ShareLink link = shareUrlBuilder.build(compact, name);
        if (link.warning() != null) {
            log.warn("ir_share_url: 链接长度 {} 超过告警阈值", link.url().length());
        }
        return new ShareUrlResult(link.url(), link.compactChars(), link.encodedChars(), link.warning());
    }

    private void requireInput(String value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        long maxBytes = properties.getMaxInputBytes().toBytes();
        // 字符数乘 3 仍不超限时无需真正编码
        if ((long) value.length() * 3 <= maxBytes) {
            return;
        }
        int bytes = value.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxBytes) {
            throw new IllegalArgumentException(
                    paramName + " 过大：" + bytes + " 字节，上限 " + maxBytes + " 字节（app.ir.max-input-bytes）");
        }
    }

    private Document readDocument(String input, String format) {
        if (FORMAT_JSON.equals(format)) {
            return DocumentJson.fromJson(input);
        }
        return CompactIr.fromCompact(input, decodeOptions(properties.getDefaultRootMode()));
    }

    private static String detectFormat(String input) {
        return input.trim().startsWith("{") ? FORMAT_JSON : FORMAT_COMPACT;
    }

    private RootMode resolveRootMode(String rootMode) {
        if (rootMode == null || rootMode.isBlank()) {
            return properties.getDefaultRootMode();
        }
        try {
            return RootMode.valueOf(rootMode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("不支持的 rootMode：" + rootMode + "（可选 SINGLE、ALL_UNREFERENCED）", e);
        }
    }

    private static CompactDecodeOptions decodeOptions(RootMode mode) {
        return new CompactDecodeOptions(mode, 0);
    }
}
