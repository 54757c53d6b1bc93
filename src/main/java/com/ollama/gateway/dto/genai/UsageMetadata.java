package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

/**
 * Token 用量
 */
public record UsageMetadata(int promptTokenCount, int candidatesTokenCount, int totalTokenCount) {

    public JSONObject toJson() {
        return JSONObject.of(
                "promptTokenCount", promptTokenCount, //
                "candidatesTokenCount", candidatesTokenCount, //
                "totalTokenCount", totalTokenCount //
        );
    }
}
