package org.vcad.ir.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.vcad.ir.Document;
import org.vcad.ir.Node;

import java.util.Map;

/**
 * 文档 JSON（{@code .vcad}）读写。
 * <p>
 * 约定：
 * <ul>
 *   <li>联合类型用 {@code type} 字段区分（Cube/Sketch2D/Line/Arc/Helix/Revolute…）。</li>
 *   <li>节点表的键是节点 id 的字符串形式，且必须与节点自身的 {@code id} 一致。</li>
 *   <li>值为 null 的可选字段不输出（{@code Node.name}、{@code Joint.parentInstanceId} 除外）。</li>
 *   <li>未知字段忽略，方便读取由更新版本写出的文档。</li>
 * </ul>
 */
public final class DocumentJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DocumentJson() {
    }

    public static String toJson(Document document) {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new DocumentJsonException("文档序列化失败：" + e.getOriginalMessage(), e);
        }
    }

    /**
     * 转为 JSON 树，便于嵌入到其它 JSON 结果中（例如 MCP 工具返回值）。
     */
    public static JsonNode toTree(Document document) {
        return OBJECT_MAPPER.valueToTree(document);
    }

    public static Document fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new DocumentJsonException("文档 JSON 为空");
        }
        Document document;
        try {
            document = OBJECT_MAPPER.readValue(json, Document.class);
        } catch (JsonProcessingException e) {
            throw new DocumentJsonException("文档 JSON 解析失败：" + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new DocumentJsonException("文档 JSON 为空");
        }
        for (Map.Entry<Long, Node> entry : document.nodes().entrySet()) {
            if (entry.getValue() == null) {
                throw new DocumentJsonException("节点 " + entry.getKey() + " 为 null");
            }
            if (entry.getKey() != entry.getValue().id()) {
                throw new DocumentJsonException(
                        "节点键 " + entry.getKey() + " 与节点 id " + entry.getValue().id() + " 不一致");
            }
        }
        return document;
    }
}
