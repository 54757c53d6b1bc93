package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 工具组，一组可包含多个函数声明
 */
public record Tool(List<FunctionDeclaration> functionDeclarations) {

    public Tool {
        functionDeclarations = functionDeclarations != null ? List.copyOf(functionDeclarations) : List.of();
    }

    public static Tool of(FunctionDeclaration... declarations) {
        return new Tool(Arrays.asList(declarations));
    }

    public static List<Tool> listFromJson(JSONArray tools) {
        if (tools == null) {
            return List.of();
        }
        List<Tool> result = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            JSONArray declarations = tool.getJSONArray("functionDeclarations");
            List<FunctionDeclaration> parsed = new ArrayList<>();
            if (declarations != null) {
                for (int j = 0; j < declarations.size(); j++) {
                    parsed.add(FunctionDeclaration.fromJson(declarations.getJSONObject(j)));
                }
            }
            result.add(new Tool(parsed));
        }
        return result;
    }
}
