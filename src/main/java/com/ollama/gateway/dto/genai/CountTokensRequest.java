package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

import java.util.List;

public record CountTokensRequest(List<Content> contents) {

    public CountTokensRequest {
        contents = contents != null ? List.copyOf(contents) : List.of();
    }

    public static CountTokensRequest fromJson(JSONObject json) {
        return new CountTokensRequest(Content.listFromJson(json.get("contents")));
    }
}
