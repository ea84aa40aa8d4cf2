package org.vcad;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VcadMcpServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(VcadMcpServerApplication.class, args);
    }

    /**
     * logback 的滚动文件目录需在 Spring 启动前就存在。
     * 目录取 LOG_PATH（系统属性优先于环境变量），未设置时为 ./logs，与 logback-spring.xml 一致。
     * 失败时只写 stderr：stdout 是 MCP stdio 通道。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("创建日志目录失败：" + logPath + "，" + e.getMessage());
        }
    }
}
