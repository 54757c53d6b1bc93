package com.ollama.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "ollama")
public class AppProperties {

    private String host = "http://localhost:11434";
    private String model = "llama3.2";
    private String embeddingModel = "nomic-embed-text";
    // 为空时不附加 Authorization 头
    private String apiKey;
    private int connectTimeoutSeconds = 30;
    private int checkTimeoutSeconds = 5;
    private ProxyConfig proxy = new ProxyConfig();

    /**
     * 去掉末尾斜杠的 Ollama 根地址
     */
    public String baseUrl() {
        if (host == null || host.isEmpty()) {
            return "http://localhost:11434";
        }
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // --- 嵌套配置类 ---

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }
}
