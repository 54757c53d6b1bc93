package com.ollama.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.proxy.ConnectivityChecker;
import com.ollama.gateway.proxy.ConnectivityReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 * <p>
 * 只展示最近一次连通性检查的结果，不主动访问 Ollama
 */
@RestController
public class HealthController {

    private final ConnectivityChecker connectivityChecker;
    private final AppProperties properties;

    public HealthController(ConnectivityChecker connectivityChecker, AppProperties properties) {
        this.connectivityChecker = connectivityChecker;
        this.properties = properties;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        ConnectivityReport report = connectivityChecker.lastReport();
        JSONObject result = new JSONObject();
        result.put("status", report.isHealthy() ? "ok" : "degraded");
        result.put("version", "1.0.0");
        result.put("ollama", JSONObject.of( //
                "host", properties.baseUrl(), //
                "connectivity", report.status().name(), //
                "availableModels", report.availableModels() //
        ));
        result.put("models", JSONObject.of( //
                "generation", properties.getModel(), //
                "embedding", properties.getEmbeddingModel() //
        ));
        if (report.message() != null) {
            result.put("message", report.message());
        }
        if (report.checkedAt() != null) {
            result.put("checkedAt", report.checkedAt().toString());
        }
        return Mono.just(result.toJSONString());
    }
}
