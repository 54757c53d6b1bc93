package com.ollama.gateway;

import com.ollama.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class OllamaGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(OllamaGatewayApplication.class);

    private final AppProperties properties;

    public OllamaGatewayApplication(AppProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(OllamaGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Ollama Gateway Java v1.0.0              ║");
        log.info("║     Gemini-style API over a local Ollama server   ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("Ollama 地址: {}, 生成模型: {}, 向量模型: {}",
                properties.baseUrl(), properties.getModel(), properties.getEmbeddingModel());
        log.info("API 端点:");
        log.info("  POST /v1beta/models/{model}:generateContent");
        log.info("  POST /v1beta/models/{model}:streamGenerateContent");
        log.info("  POST /v1beta/models/{model}:embedContent");
        log.info("  POST /v1beta/models/{model}:countTokens");
        log.info("  POST /v1beta/models/{model}:generateJson");
        log.info("  GET  /health");
    }
}
