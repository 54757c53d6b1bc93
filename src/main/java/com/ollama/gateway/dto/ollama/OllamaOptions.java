package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * Ollama 采样参数，null 字段不输出
 */
public record OllamaOptions(Double temperature, Double topP, Integer numPredict, List<String> stop) {

    public OllamaOptions {
        stop = stop != null ? List.copyOf(stop) : null;
    }

    public boolean isEmpty() {
        return temperature == null && topP == null && numPredict == null && stop == null;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (temperature != null) {
            json.put("temperature", temperature);
        }
        if (topP != null) {
            json.put("top_p", topP);
        }
        if (numPredict != null) {
            json.put("num_predict", numPredict);
        }
        if (stop != null) {
            json.put("stop", stop);
        }
        return json;
    }
}
