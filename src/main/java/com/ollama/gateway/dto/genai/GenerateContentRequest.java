package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成请求
 *
 * @param model             请求路径中的模型名，仅用于日志
 * @param contents          对话内容
 * @param systemInstruction 系统指令，可为空
 * @param generationConfig  采样参数
 * @param tools             工具声明
 */
public record GenerateContentRequest(String model,
                                     List<Content> contents,
                                     Content systemInstruction,
                                     GenerationConfig generationConfig,
                                     List<Tool> tools) {

    public GenerateContentRequest {
        contents = contents != null ? List.copyOf(contents) : List.of();
        generationConfig = generationConfig != null ? generationConfig : GenerationConfig.EMPTY;
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public static GenerateContentRequest of(List<Content> contents) {
        return new GenerateContentRequest(null, contents, null, null, null);
    }

    /**
     * 系统指令（若有）以 system 角色排在最前
     */
    public List<Content> effectiveContents() {
        if (systemInstruction == null) {
            return contents;
        }
        List<Content> all = new ArrayList<>(contents.size() + 1);
        all.add(new Content(Content.ROLE_SYSTEM, systemInstruction.parts()));
        all.addAll(contents);
        return all;
    }

    public static GenerateContentRequest fromJson(JSONObject json, String model) {
        JSONObject system = json.getJSONObject("systemInstruction");
        return new GenerateContentRequest(
                model,
                Content.listFromJson(json.get("contents")),
                system != null ? Content.fromJson(system) : null,
                GenerationConfig.fromJson(json.getJSONObject("generationConfig")),
                Tool.listFromJson(json.getJSONArray("tools"))
        );
    }
}
