package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSONObject;

/**
 * POST /api/chat 响应（非流式整体，或流式的一行）
 *
 * @param model           模型名
 * @param createdAt       创建时间
 * @param message         助手消息
 * @param done            是否结束
 * @param promptEvalCount 输入 token 数，可为空
 * @param evalCount       输出 token 数，可为空
 * @param totalDuration   总耗时（纳秒），可为空
 */
public record OllamaChatResponse(String model,
                                 String createdAt,
                                 OllamaMessage message,
                                 boolean done,
                                 Integer promptEvalCount,
                                 Integer evalCount,
                                 Long totalDuration) {

    public OllamaChatResponse {
        message = message != null ? message : OllamaMessage.of("assistant", "");
    }

    public static OllamaChatResponse fromJson(JSONObject json) {
        return new OllamaChatResponse(
                json.getString("model"),
                json.getString("created_at"),
                OllamaMessage.fromJson(json.getJSONObject("message")),
                json.getBooleanValue("done"),
                json.getInteger("prompt_eval_count"),
                json.getInteger("eval_count"),
                json.getLong("total_duration")
        );
    }
}
