package com.ollama.gateway.service;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.dto.genai.Content;
import com.ollama.gateway.dto.genai.CountTokensRequest;
import com.ollama.gateway.dto.genai.CountTokensResponse;
import com.ollama.gateway.dto.genai.EmbedContentRequest;
import com.ollama.gateway.dto.genai.EmbedContentResponse;
import com.ollama.gateway.dto.genai.GenerateContentRequest;
import com.ollama.gateway.dto.genai.GenerateContentResponse;
import com.ollama.gateway.dto.genai.GenerationConfig;

import java.util.List;

/**
 * 内容生成契约，与具体后端无关
 */
public interface ContentGenerator {

    GenerateContentResponse generateContent(GenerateContentRequest request);

    /**
     * 流式生成，调用方消费完或放弃时必须 close()
     */
    GenerateContentStream generateContentStream(GenerateContentRequest request);

    EmbedContentResponse embedContent(EmbedContentRequest request);

    CountTokensResponse countTokens(CountTokensRequest request);

    /**
     * 生成符合 schema 的 JSON 值，解析失败时返回按 schema 合成的兜底值
     */
    Object generateJson(List<Content> contents, JSONObject schema, GenerationConfig config);
}
