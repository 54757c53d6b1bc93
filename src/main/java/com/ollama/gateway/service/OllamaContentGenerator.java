package com.ollama.gateway.service;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.dto.genai.Content;
import com.ollama.gateway.dto.genai.CountTokensRequest;
import com.ollama.gateway.dto.genai.CountTokensResponse;
import com.ollama.gateway.dto.genai.EmbedContentRequest;
import com.ollama.gateway.dto.genai.EmbedContentResponse;
import com.ollama.gateway.dto.genai.GenerateContentRequest;
import com.ollama.gateway.dto.genai.GenerateContentResponse;
import com.ollama.gateway.dto.genai.GenerationConfig;
import com.ollama.gateway.dto.genai.Part;
import com.ollama.gateway.dto.genai.UsageMetadata;
import com.ollama.gateway.dto.ollama.OllamaChatRequest;
import com.ollama.gateway.dto.ollama.OllamaChatResponse;
import com.ollama.gateway.dto.ollama.OllamaEmbedRequest;
import com.ollama.gateway.dto.ollama.OllamaEmbedResponse;
import com.ollama.gateway.dto.ollama.OllamaOptions;
import com.ollama.gateway.exception.EmptyResponseException;
import com.ollama.gateway.proxy.ChatResponseStream;
import com.ollama.gateway.proxy.ConnectivityChecker;
import com.ollama.gateway.proxy.OllamaApiClient;
import com.ollama.gateway.translator.MessageTranslator;
import com.ollama.gateway.translator.ResponseTranslator;
import com.ollama.gateway.translator.ToolBridge;
import com.ollama.gateway.translator.structured.StructuredOutputExtractor;
import com.ollama.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Ollama 的内容生成实现
 * <p>
 * 负责组装 /api/chat 请求、调用下游并把响应转换回通用格式。
 * 下游失败直接抛出，不重试。
 */
@Component
public class OllamaContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(OllamaContentGenerator.class);

    static final String JSON_SYSTEM_PROMPT = "You are a JSON-only assistant. You must only respond with valid JSON. "
            + "Do not use thinking tags or any other formatting.";

    static final String JSON_USER_PROMPT_TEMPLATE = "IMPORTANT: You must respond with valid JSON only. "
            + "Do not include <think> tags, explanations, thoughts, or any other text. "
            + "Only output the JSON object that follows this exact schema: %s\n\nOriginal request:";

    static final List<String> THINK_STOP_SEQUENCES = List.of("<think>", "</think>");

    private final OllamaApiClient apiClient;
    private final MessageTranslator messageTranslator;
    private final ToolBridge toolBridge;
    private final ResponseTranslator responseTranslator;
    private final StructuredOutputExtractor structuredOutputExtractor;
    private final AppProperties properties;

    public OllamaContentGenerator(OllamaApiClient apiClient,
                                  MessageTranslator messageTranslator,
                                  ToolBridge toolBridge,
                                  ResponseTranslator responseTranslator,
                                  StructuredOutputExtractor structuredOutputExtractor,
                                  ConnectivityChecker connectivityChecker,
                                  AppProperties properties) {
        this.apiClient = apiClient;
        this.messageTranslator = messageTranslator;
        this.toolBridge = toolBridge;
        this.responseTranslator = responseTranslator;
        this.structuredOutputExtractor = structuredOutputExtractor;
        this.properties = properties;

        // 后台检查，不等待结果
        connectivityChecker.checkAsync();
    }

    @Override
    public GenerateContentResponse generateContent(GenerateContentRequest request) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            OllamaChatResponse response = apiClient.chat(buildChatRequest(request, false));
            GenerateContentResponse result = responseTranslator.translate(response);
            recordUsage(result.usageMetadata());
            success = true;
            return result;
        } finally {
            long latency = System.currentTimeMillis() - start;
            Metrics.instance().recordRequest("generate", success, latency);
            log.info("生成完成: model={}, success={}, latency={}ms", properties.getModel(), success, latency);
        }
    }

    @Override
    public GenerateContentStream generateContentStream(GenerateContentRequest request) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            ChatResponseStream stream = apiClient.chatStream(buildChatRequest(request, true));
            success = true;
            return new GenerateContentStream(stream, responseTranslator);
        } finally {
            Metrics.instance().recordRequest("stream", success, System.currentTimeMillis() - start);
        }
    }

    @Override
    public EmbedContentResponse embedContent(EmbedContentRequest request) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            OllamaEmbedResponse response = apiClient.embed(
                    new OllamaEmbedRequest(properties.getEmbeddingModel(), request.firstText()));
            success = true;
            return new EmbedContentResponse(response.first());
        } finally {
            Metrics.instance().recordRequest("embed", success, System.currentTimeMillis() - start);
        }
    }

    /**
     * 粗略估算：每 4 个字符算 1 个 token，向上取整，不访问下游
     */
    @Override
    public CountTokensResponse countTokens(CountTokensRequest request) {
        long chars = 0;
        for (Content content : request.contents()) {
            for (Part part : content.parts()) {
                if (part instanceof Part.Text t) {
                    chars += t.text().length();
                }
            }
        }
        return new CountTokensResponse((int) ((chars + 3) / 4), 0);
    }

    @Override
    public Object generateJson(List<Content> contents, JSONObject schema, GenerationConfig config) {
        GenerationConfig cfg = config != null ? config : GenerationConfig.EMPTY;
        JSONObject effectiveSchema = schema != null ? schema : new JSONObject();

        List<Content> wrapped = new ArrayList<>(contents.size() + 2);
        wrapped.add(Content.system(JSON_SYSTEM_PROMPT));
        wrapped.add(Content.user(String.format(JSON_USER_PROMPT_TEMPLATE, effectiveSchema.toJSONString())));
        wrapped.addAll(contents);

        List<String> stop = new ArrayList<>();
        if (cfg.stopSequences() != null) {
            stop.addAll(cfg.stopSequences());
        }
        stop.addAll(THINK_STOP_SEQUENCES);

        OllamaOptions options = new OllamaOptions(
                cfg.temperature() != null ? cfg.temperature() : 0.0,
                cfg.topP() != null ? cfg.topP() : 1.0,
                cfg.maxOutputTokens(),
                stop);
        OllamaChatRequest request = new OllamaChatRequest(
                properties.getModel(),
                messageTranslator.translate(wrapped),
                false,
                OllamaChatRequest.FORMAT_JSON,
                options,
                List.of());

        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            GenerateContentResponse response = responseTranslator.translate(apiClient.chat(request));
            recordUsage(response.usageMetadata());
            String text = response.text();
            if (text.isEmpty()) {
                throw new EmptyResponseException("模型未返回任何文本, 无法生成 JSON");
            }
            Object value = structuredOutputExtractor.extract(text, effectiveSchema);
            success = true;
            return value;
        } finally {
            Metrics.instance().recordRequest("json", success, System.currentTimeMillis() - start);
        }
    }

    /**
     * 组装 /api/chat 请求体；model 始终使用配置值，请求路径中的模型名只用于日志
     */
    OllamaChatRequest buildChatRequest(GenerateContentRequest request, boolean stream) {
        if (request.model() != null && !request.model().equals(properties.getModel())) {
            log.debug("忽略请求模型 {}, 使用配置模型 {}", request.model(), properties.getModel());
        }
        GenerationConfig cfg = request.generationConfig();
        return new OllamaChatRequest(
                properties.getModel(),
                messageTranslator.translate(request.effectiveContents()),
                stream,
                null,
                new OllamaOptions(cfg.temperature(), cfg.topP(), cfg.maxOutputTokens(), cfg.stopSequences()),
                toolBridge.toOllamaTools(request.tools()));
    }

    private static void recordUsage(UsageMetadata usage) {
        if (usage != null) {
            Metrics.instance().recordTokens(usage.promptTokenCount(), usage.candidatesTokenCount());
        }
    }
}
