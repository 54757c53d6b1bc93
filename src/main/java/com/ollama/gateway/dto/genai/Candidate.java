package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

/**
 * 候选结果
 *
 * @param content      模型输出，角色固定为 model
 * @param finishReason 未结束时为 null
 * @param index        候选序号
 */
public record Candidate(Content content, FinishReason finishReason, int index) {

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("content", content.toJson());
        if (finishReason != null) {
            json.put("finishReason", finishReason.name());
        }
        json.put("index", index);
        return json;
    }
}
