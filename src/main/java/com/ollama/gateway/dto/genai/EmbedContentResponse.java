package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * 向量化响应，只包含第一个向量
 */
public record EmbedContentResponse(List<Double> values) {

    public EmbedContentResponse {
        values = values != null ? List.copyOf(values) : List.of();
    }

    public JSONObject toJson() {
        return JSONObject.of("embedding", JSONObject.of("values", values));
    }
}
