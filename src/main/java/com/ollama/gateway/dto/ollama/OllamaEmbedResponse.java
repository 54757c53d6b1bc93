package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * POST /api/embed 响应
 */
public record OllamaEmbedResponse(List<List<Double>> embeddings) {

    public OllamaEmbedResponse {
        embeddings = embeddings != null ? List.copyOf(embeddings) : List.of();
    }

    public List<Double> first() {
        return embeddings.isEmpty() ? List.of() : embeddings.get(0);
    }

    public static OllamaEmbedResponse fromJson(JSONObject json) {
        JSONArray arr = json.getJSONArray("embeddings");
        List<List<Double>> embeddings = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.size(); i++) {
                JSONArray vector = arr.getJSONArray(i);
                embeddings.add(vector != null ? vector.toJavaList(Double.class) : List.of());
            }
        }
        return new OllamaEmbedResponse(embeddings);
    }
}
