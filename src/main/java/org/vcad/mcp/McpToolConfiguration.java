package org.vcad.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 会从 Spring 容器中收集 {@link ToolCallback}，
 * 并通过 MCP 协议把 Compact IR 的解析、编码、校验、分析与分享能力暴露给调用方（模型或 IDE 插件）。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> compactIrToolCallbacks(CompactIrMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
