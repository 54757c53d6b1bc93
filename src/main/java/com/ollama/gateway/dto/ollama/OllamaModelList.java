package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * GET /api/tags 响应，只保留模型名
 */
public record OllamaModelList(List<String> names) {

    public OllamaModelList {
        names = names != null ? List.copyOf(names) : List.of();
    }

    public boolean contains(String model) {
        return names.contains(model);
    }

    public static OllamaModelList fromJson(JSONObject json) {
        List<String> names = new ArrayList<>();
        JSONArray models = json.getJSONArray("models");
        if (models != null) {
            for (int i = 0; i < models.size(); i++) {
                JSONObject model = models.getJSONObject(i);
                String name = model != null ? model.getString("name") : null;
                if (name != null) {
                    names.add(name);
                }
            }
        }
        return new OllamaModelList(names);
    }
}
