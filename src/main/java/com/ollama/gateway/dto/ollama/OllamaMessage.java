package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Ollama 消息
 * <p>
 * images / tool_calls 为空时不输出
 *
 * @param role      system / user / assistant
 * @param content   文本内容
 * @param images    base64 图片
 * @param toolCalls 工具调用
 */
public record OllamaMessage(String role, String content, List<String> images, List<OllamaToolCall> toolCalls) {

    public OllamaMessage {
        content = content != null ? content : "";
        images = images != null ? List.copyOf(images) : List.of();
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static OllamaMessage of(String role, String content) {
        return new OllamaMessage(role, content, null, null);
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public JSONObject toJson() {
        JSONObject json = JSONObject.of("role", role, "content", content);
        if (hasImages()) {
            json.put("images", new JSONArray(images));
        }
        if (hasToolCalls()) {
            JSONArray calls = new JSONArray();
            for (OllamaToolCall call : toolCalls) {
                calls.add(call.toJson());
            }
            json.put("tool_calls", calls);
        }
        return json;
    }

    public static OllamaMessage fromJson(JSONObject json) {
        if (json == null) {
            return of("assistant", "");
        }
        List<OllamaToolCall> toolCalls = new ArrayList<>();
        JSONArray calls = json.getJSONArray("tool_calls");
        if (calls != null) {
            for (int i = 0; i < calls.size(); i++) {
                JSONObject call = calls.getJSONObject(i);
                if (call != null) {
                    toolCalls.add(OllamaToolCall.fromJson(call));
                }
            }
        }
        JSONArray images = json.getJSONArray("images");
        return new OllamaMessage(
                json.getString("role"),
                json.getString("content"),
                images != null ? images.toJavaList(String.class) : null,
                toolCalls
        );
    }
}
