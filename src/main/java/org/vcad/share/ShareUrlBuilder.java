package org.vcad.share;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 生成可在 vcad Web 应用中直接打开的分享链接。
 * <p>
 * 链接格式：{@code {baseUrl}/#/new?doc=<gzip+base64url>&name=<名称>}。
 * 文档先转为 Compact IR（最紧凑的文本形式），再以最高压缩级别 gzip，最后做无填充的 base64url 编码。
 * 浏览器对地址长度有限制（约 2000 字符），超出 {@code warnLength} 时在结果中给出告警。
 */
public class ShareUrlBuilder {

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

    private final String baseUrl;
    private final int warnLength;

    public ShareUrlBuilder(String baseUrl, int warnLength) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl 不能为空");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
        this.warnLength = warnLength;
    }

    /**
     * @param url          完整链接
     * @param compactChars Compact IR 文本长度
     * @param encodedChars 压缩编码后的 doc 参数长度
     * @param warning      链接过长时的提示，否则为 null
     */
    public record ShareLink(String url, int compactChars, int encodedChars, String warning) {
    }

    public ShareLink build(String compactIr, String name) {
        String encoded = compress(compactIr);
        StringBuilder url = new StringBuilder(baseUrl).append("/#/new?doc=").append(encoded);
        if (name != null && !name.isBlank()) {
            url.append("&name=").append(URLEncoder.encode(name, StandardCharsets.UTF_8));
        }
        String warning = null;
        if (url.length() > warnLength) {
            warning = "链接长度为 " + url.length() + " 个字符，超过 " + warnLength
                    + "，部分浏览器可能会截断，较大的文档建议导出为文件。";
        }
        return new ShareLink(url.toString(), compactIr.length(), encoded.length(), warning);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * gzip（最高压缩级别）+ base64url（无填充）。
     */
    public static String compress(String text) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new BestCompressionGzip(bytes)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("gzip 压缩失败：", e);
        }
        return URL_ENCODER.encodeToString(bytes.toByteArray());
    }

    /**
     * {@link #compress(String)} 的逆操作，用于还原链接中的 doc 参数。
     */
    public static String decompress(String encoded) {
        byte[] compressed;
        try {
            compressed = URL_DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("doc 参数不是合法的 base64url：" + e.getMessage(), e);
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("doc 参数不是合法的 gzip 数据：" + e.getMessage(), e);
        }
    }

    private static final class BestCompressionGzip extends GZIPOutputStream {
        private BestCompressionGzip(ByteArrayOutputStream out) throws IOException {
            super(out);
            def.setLevel(Deflater.BEST_COMPRESSION);
        }
    }
}
