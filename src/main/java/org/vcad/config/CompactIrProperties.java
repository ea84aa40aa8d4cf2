package org.vcad.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;
import org.vcad.ir.compact.RootMode;

/**
 * Compact IR MCP Server 的业务配置（{@code app.ir.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #maxInputBytes} 限制单次工具调用的输入体积；编解码本身没有超时/取消机制，只能在入口处限流。</li>
 *   <li>通过 {@link #shareBaseUrl} 指定分享链接指向的 Web 应用（默认读取环境变量 {@code VCAD_APP_URL}）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.ir")
public class CompactIrProperties {

    /**
     * 单次工具调用允许的最大输入（Compact IR 文本或文档 JSON，按 UTF-8 字节计）。
     */
    @NotNull
    private DataSize maxInputBytes = DataSize.ofMegabytes(1);

    /**
     * 分享链接的基础地址。
     */
    @NotBlank
    private String shareBaseUrl = "https://vcad.io";

    /**
     * 分享链接超过该长度时给出告警（浏览器通常只保证约 2000 字符）。
     */
    @Min(100)
    @Max(1_000_000)
    private int shareUrlWarnLength = 2000;

    /**
     * {@code ir_parse_compact} 未指定 rootMode 时使用的根推断方式。
     */
    @NotNull
    private RootMode defaultRootMode = RootMode.SINGLE;

    /**
     * {@code ir_to_compact} 未指定 versionHeader 时是否输出 {@code # vcad 0.2} 版本头。
     */
    private boolean versionHeader = false;

    public DataSize getMaxInputBytes() {
        return maxInputBytes;
    }

    public void setMaxInputBytes(DataSize maxInputBytes) {
        this.maxInputBytes = maxInputBytes;
    }

    public String getShareBaseUrl() {
        return shareBaseUrl;
    }

    public void setShareBaseUrl(String shareBaseUrl) {
        this.shareBaseUrl = shareBaseUrl;
    }

    public int getShareUrlWarnLength() {
        return shareUrlWarnLength;
    }

    public void setShareUrlWarnLength(int shareUrlWarnLength) {
        this.shareUrlWarnLength = shareUrlWarnLength;
    }

    public RootMode getDefaultRootMode() {
        return defaultRootMode;
    }

    public void setDefaultRootMode(RootMode defaultRootMode) {
        this.defaultRootMode = defaultRootMode;
    }

    public boolean isVersionHeader() {
        return versionHeader;
    }

    public void setVersionHeader(boolean versionHeader) {
        this.versionHeader = versionHeader;
    }
}
