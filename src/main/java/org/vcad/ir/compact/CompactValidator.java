package org.vcad.ir.compact;

import org.vcad.ir.Document;

/**
 * 校验一段 Compact IR 是否可用：能解析、非空、至少有一个根。
 * <p>
 * 与 {@link CompactIr#fromCompact(String)} 不同，校验失败以结果返回而不是抛异常，适合批量检查生成语料。
 */
public final class CompactValidator {

    private CompactValidator() {
    }

    public enum Failure {
        PARSE_ERROR("parse_error"),
        EMPTY_DOCUMENT("empty_document"),
        NO_ROOTS("no_roots");

        private final String code;

        Failure(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * @param failure  失败原因；通过时为 null
     * @param message  失败说明；通过时为 null
     * @param line     解析失败的物理行号；其它情况为 null
     * @param document 解析得到的文档；解析失败时为 null
     */
    public record Result(Failure failure, String message, Integer line, Document document) {

        public boolean valid() {
            return failure == null;
        }
    }

    public static Result validate(String compact, CompactDecodeOptions options) {
        Document document;
        try {
            document = CompactIr.fromCompact(compact, options);
        } catch (CompactParseException e) {
            return new Result(Failure.PARSE_ERROR, e.getMessage(), e.getLine(), null);
        }
        if (document.nodes().isEmpty()) {
            return new Result(Failure.EMPTY_DOCUMENT, "文档中没有任何节点", null, document);
        }
        // 非空文档总能推断出根（ROOT 行也必须指向已有节点），此分支只为保留 no_roots 错误码。
        if (document.roots().isEmpty()) {
            return new Result(Failure.NO_ROOTS, "文档中没有根节点", null, document);
        }
        return new Result(null, null, null, document);
    }
}
