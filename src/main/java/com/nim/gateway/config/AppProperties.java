package com.nim.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "nim")
public class AppProperties {

    private String apiBase = "https://integrate.api.nvidia.com/v1";
    private String apiKey = "";
    private List<AliasConfig> modelMapping = new ArrayList<>();
    private ReasoningConfig reasoning = new ReasoningConfig();
    private ThinkingConfig thinking = new ThinkingConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private DefaultsConfig defaults = new DefaultsConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    /**
     * 单条别名：对外模型名 → NIM 模型名
     */
    @Data
    public static class AliasConfig {
        private String name;
        private String target;
    }

    @Data
    public static class ReasoningConfig {
        // 是否把 reasoning_content 以 <think> 块的形式并入 content
        private boolean show = false;
    }

    @Data
    public static class ThinkingConfig {
        private boolean enabled = true;
        private List<String> capableModels = new ArrayList<>();
    }

    @Data
    public static class FallbackConfig {
        private String large = "meta/llama-3.1-405b-instruct";
        private String mid = "meta/llama-3.1-70b-instruct";
        private String small = "meta/llama-3.1-8b-instruct";
    }

    @Data
    public static class DefaultsConfig {
        private double temperature = 0.85;
        private int maxTokens = 16384;
    }

    @Data
    public static class UpstreamConfig {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
