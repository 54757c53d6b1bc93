package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONObject;

/**
 * Ollama 工具定义：每个条目只携带一个函数
 */
public record OllamaTool(String name, String description, JSONObject parameters) {

    public JSONObject toJson() {
        JSONObject function = new JSONObject();
        function.put("name", name);
        if (description != null) {
            function.put("description", description);
        }
        function.put("parameters", parameters != null ? parameters : new JSONObject());
        return JSONObject.of("type", "function", "function", function);
    }
}
