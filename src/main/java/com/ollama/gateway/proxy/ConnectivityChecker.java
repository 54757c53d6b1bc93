package com.ollama.gateway.proxy;

import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.dto.ollama.OllamaModelList;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ollama 连通性检查
 * <p>
 * 后台执行，不阻塞也不会让调用方失败；连接失败和模型缺失都只通过 {@link WarningSink} 报告。
 * 最近一次结果供 /health 展示。
 */
@Component
public class ConnectivityChecker {

    private final OllamaApiClient apiClient;
    private final AppProperties properties;
    private final WarningSink warningSink;
    private final AtomicReference<ConnectivityReport> lastReport = new AtomicReference<>(ConnectivityReport.PENDING);

    public ConnectivityChecker(OllamaApiClient apiClient, AppProperties properties, WarningSink warningSink) {
        this.apiClient = apiClient;
        this.properties = properties;
        this.warningSink = warningSink;
    }

    /**
     * 发起检查，返回的 future 永远正常完成
     */
    public CompletableFuture<ConnectivityReport> checkAsync() {
        CompletableFuture<OllamaModelList> models;
        try {
            models = apiClient.listModels(Duration.ofSeconds(properties.getCheckTimeoutSeconds()));
        } catch (Exception e) {
            models = CompletableFuture.failedFuture(e);
        }
        if (models == null) {
            models = CompletableFuture.failedFuture(new IllegalStateException("未获得模型列表"));
        }

        return models.handle((list, error) -> {
            ConnectivityReport report = error != null ? unreachable(error) : inspect(list);
            lastReport.set(report);
            return report;
        });
    }

    public ConnectivityReport lastReport() {
        return lastReport.get();
    }

    private ConnectivityReport unreachable(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message = "无法连接到 Ollama " + properties.baseUrl() + ": " + cause.getMessage();
        warningSink.warn(message);
        warningSink.warn("请确认 Ollama 已启动并且可以访问");
        return new ConnectivityReport(ConnectivityReport.Status.UNREACHABLE, List.of(), message, Instant.now());
    }

    private ConnectivityReport inspect(OllamaModelList list) {
        String model = properties.getModel();
        // Ollama 会给未带标签的模型补上 :latest
        if (list.contains(model) || list.contains(model + ":latest")) {
            return new ConnectivityReport(ConnectivityReport.Status.OK, list.names(), null, Instant.now());
        }
        String message = "模型 '" + model + "' 不在 Ollama 中, 可用模型: " + String.join(", ", list.names());
        warningSink.warn(message);
        warningSink.warn("拉取模型: ollama pull " + model);
        return new ConnectivityReport(ConnectivityReport.Status.MODEL_MISSING, list.names(), message, Instant.now());
    }
}
