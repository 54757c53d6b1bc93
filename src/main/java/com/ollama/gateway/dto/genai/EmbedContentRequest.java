package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;

/**
 * 向量化请求
 * <p>
 * 只使用 content 的第一个文本 part
 */
public record EmbedContentRequest(String model, Content content) {

    public String firstText() {
        if (content == null || content.parts().isEmpty()) {
            return "";
        }
        return content.parts().get(0) instanceof Part.Text t ? t.text() : "";
    }

    public static EmbedContentRequest fromJson(JSONObject json, String model) {
        JSONObject content = json.getJSONObject("content");
        return new EmbedContentRequest(model, content != null ? Content.fromJson(content) : null);
    }
}
