package com.ollama.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.dto.ollama.OllamaChatRequest;
import com.ollama.gateway.dto.ollama.OllamaChatResponse;
import com.ollama.gateway.dto.ollama.OllamaEmbedRequest;
import com.ollama.gateway.dto.ollama.OllamaEmbedResponse;
import com.ollama.gateway.dto.ollama.OllamaModelList;
import com.ollama.gateway.exception.MissingBodyException;
import com.ollama.gateway.exception.OllamaApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Ollama HTTP 客户端
 * <p>
 * /api/chat（非流式 + 流式）、/api/embed、/api/tags。
 * 非 2xx 直接抛出，不重试。
 */
@Component
public class OllamaApiClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaApiClient.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public OllamaApiClient(HttpClient ollamaHttpClient, AppProperties properties) {
        this.httpClient = ollamaHttpClient;
        this.properties = properties;
    }

    /**
     * 非流式对话
     */
    public OllamaChatResponse chat(OllamaChatRequest request) {
        String payload = request.toJsonString();
        log.debug("POST /api/chat: model={}, messages={}, stream=false", request.model(), request.messages().size());

        HttpResponse<String> response = send("chat", post("/api/chat", payload), HttpResponse.BodyHandlers.ofString());
        ensureSuccess("chat", response.statusCode(), response.body());
        return OllamaChatResponse.fromJson(parseBody("chat", response.body()));
    }

    /**
     * 流式对话，返回按需读取的迭代器，调用方负责 close()
     */
    public ChatResponseStream chatStream(OllamaChatRequest request) {
        String payload = request.toJsonString();
        log.debug("POST /api/chat: model={}, messages={}, stream=true", request.model(), request.messages().size());

        HttpResponse<InputStream> response = send("chat", post("/api/chat", payload), HttpResponse.BodyHandlers.ofInputStream());
        InputStream body = response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new OllamaApiException("chat", response.statusCode(), readBody(body));
        }
        if (body == null) {
            throw new MissingBodyException();
        }
        return new ChatResponseStream(body);
    }

    /**
     * 向量化
     */
    public OllamaEmbedResponse embed(OllamaEmbedRequest request) {
        log.debug("POST /api/embed: model={}", request.model());

        HttpResponse<String> response = send("embed", post("/api/embed", request.toJsonString()), HttpResponse.BodyHandlers.ofString());
        ensureSuccess("embed", response.statusCode(), response.body());
        return OllamaEmbedResponse.fromJson(parseBody("embed", response.body()));
    }

    /**
     * 异步获取本地模型列表，用于连通性检查
     */
    public CompletableFuture<OllamaModelList> listModels(Duration timeout) {
        HttpRequest request = baseRequest("/api/tags")
                .timeout(timeout)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    ensureSuccess("tags", response.statusCode(), response.body());
                    return OllamaModelList.fromJson(parseBody("tags", response.body()));
                });
    }

    // ==================== 辅助方法 ====================

    private HttpRequest post(String path, String payload) {
        return baseRequest(path)
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
    }

    private HttpRequest.Builder baseRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + path))
                .header("Content-Type", "application/json");
        if (properties.hasApiKey()) {
            builder.header("Authorization", "Bearer " + properties.getApiKey());
        }
        return builder;
    }

    private <T> HttpResponse<T> send(String operation, HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            log.error("调用 Ollama 异常: operation={}, uri={}", operation, request.uri(), e);
            throw new OllamaApiException(operation, 502, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OllamaApiException(operation, 499, "请求被中断", e);
        }
    }

    private static void ensureSuccess(String operation, int statusCode, String body) {
        if (statusCode < 200 || statusCode >= 300) {
            throw new OllamaApiException(operation, statusCode, body);
        }
    }

    private static JSONObject parseBody(String operation, String body) {
        try {
            JSONObject json = JSONObject.parseObject(body);
            if (json == null) {
                throw new OllamaApiException(operation, 502, "响应体为空");
            }
            return json;
        } catch (OllamaApiException e) {
            throw e;
        } catch (Exception e) {
            throw new OllamaApiException(operation, 502, "响应不是合法 JSON: " + e.getMessage(), e);
        }
    }

    private static String readBody(InputStream body) {
        if (body == null) {
            return "";
        }
        try (body) {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            return "读取响应体失败: " + e.getMessage();
        }
    }
}
