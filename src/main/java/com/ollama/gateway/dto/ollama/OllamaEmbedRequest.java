package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONObject;

/**
 * POST /api/embed 请求体
 */
public record OllamaEmbedRequest(String model, String input) {

    public String toJsonString() {
        return JSONObject.of("model", model, "input", input).toJSONString();
    }
}
