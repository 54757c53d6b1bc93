package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

/**
 * 函数声明
 *
 * @param name        函数名
 * @param description 描述
 * @param parameters  参数 JSON Schema
 */
public record FunctionDeclaration(String name, String description, JSONObject parameters) {

    public static FunctionDeclaration fromJson(JSONObject json) {
        return new FunctionDeclaration(
                json.getString("name"),
                json.getString("description"),
                json.getJSONObject("parameters")
        );
    }
}
