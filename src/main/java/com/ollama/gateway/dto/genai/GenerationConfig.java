package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * 采样参数，全部可选
 */
public record GenerationConfig(Double temperature, Double topP, Integer maxOutputTokens, List<String> stopSequences) {

    public static final GenerationConfig EMPTY = new GenerationConfig(null, null, null, null);

    public GenerationConfig {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : null;
    }

    public static GenerationConfig fromJson(JSONObject json) {
        if (json == null) {
            return EMPTY;
        }
        JSONArray stop = json.getJSONArray("stopSequences");
        return new GenerationConfig(
                json.getDouble("temperature"),
                json.getDouble("topP"),
                json.getInteger("maxOutputTokens"),
                stop != null ? stop.toJavaList(String.class) : null
        );
    }
}
