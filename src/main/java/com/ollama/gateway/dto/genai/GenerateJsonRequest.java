package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.exception.InvalidRequestException;

import java.util.List;

/**
 * 结构化输出请求
 *
 * @param contents         对话内容
 * @param schema           期望输出的 JSON Schema
 * @param generationConfig 采样参数
 */
public record GenerateJsonRequest(List<Content> contents, JSONObject schema, GenerationConfig generationConfig) {

    public GenerateJsonRequest {
        contents = contents != null ? List.copyOf(contents) : List.of();
        schema = schema != null ? schema : new JSONObject();
        generationConfig = generationConfig != null ? generationConfig : GenerationConfig.EMPTY;
    }

    public static GenerateJsonRequest fromJson(JSONObject json) {
        JSONObject schema = json.getJSONObject("schema");
        if (schema == null) {
            throw new InvalidRequestException("generateJson 需要 schema 字段");
        }
        return new GenerateJsonRequest(
                Content.listFromJson(json.get("contents")),
                schema,
                GenerationConfig.fromJson(json.getJSONObject("generationConfig"))
        );
    }
}
