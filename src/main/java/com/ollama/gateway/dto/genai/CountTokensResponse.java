package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

public record CountTokensResponse(int totalTokens, int cachedContentTokenCount) {

    public JSONObject toJson() {
        return JSONObject.of("totalTokens", totalTokens, "cachedContentTokenCount", cachedContentTokenCount);
    }
}
