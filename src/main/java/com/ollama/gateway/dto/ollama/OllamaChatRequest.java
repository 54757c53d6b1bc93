package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * POST /api/chat 请求体
 *
 * @param model    模型名
 * @param messages 消息列表
 * @param stream   是否流式
 * @param format   "json" 或 null
 * @param options  采样参数，可为空
 * @param tools    工具列表，为空时不输出
 */
public record OllamaChatRequest(String model,
                                List<OllamaMessage> messages,
                                boolean stream,
                                String format,
                                OllamaOptions options,
                                List<OllamaTool> tools) {

    public static final String FORMAT_JSON = "json";

    public OllamaChatRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public JSONObject toJson() {
        JSONArray messagesJson = new JSONArray();
        for (OllamaMessage message : messages) {
            messagesJson.add(message.toJson());
        }
        JSONObject json = JSONObject.of(
                "model", model, //
                "messages", messagesJson, //
                "stream", stream //
        );
        if (format != null) {
            json.put("format", format);
        }
        if (options != null && !options.isEmpty()) {
            json.put("options", options.toJson());
        }
        if (!tools.isEmpty()) {
            JSONArray toolsJson = new JSONArray();
            for (OllamaTool tool : tools) {
                toolsJson.add(tool.toJson());
            }
            json.put("tools", toolsJson);
        }
        return json;
    }

    public String toJsonString() {
        return toJson().toJSONString();
    }
}
