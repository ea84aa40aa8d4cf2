package org.vcad.mcp.dto;

/**
 * {@code ir_share_url} 的返回结果。
 *
 * @param url          可直接在浏览器打开的链接
 * @param compactChars Compact IR 文本长度
 * @param encodedChars 压缩后 doc 参数的长度
 * @param warning      链接过长的提示
 */
public record ShareUrlResult(String url, int compactChars, int encodedChars, String warning) {
}
