package org.vcad.ir.json;

/**
 * 文档 JSON 无法解析或不符合文档结构。
 */
public class DocumentJsonException extends RuntimeException {

    public DocumentJsonException(String message) {
        super(message);
    }

    public DocumentJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
