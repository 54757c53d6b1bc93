package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.exception.InvalidRequestException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对话内容片段
 * <p>
 * 四种互斥形态：文本、内联二进制、函数调用、函数结果。
 * JSON 形态与 Gemini 一致，每个 part 只有一个键。
 */
public sealed interface Part permits Part.Text, Part.InlineData, Part.FunctionCall, Part.FunctionResponse {

    JSONObject toJson();

    static Text text(String text) {
        return new Text(text);
    }

    static InlineData inlineData(String mimeType, String data) {
        return new InlineData(mimeType, data);
    }

    static FunctionCall functionCall(String name, Map<String, Object> args) {
        return new FunctionCall(name, args);
    }

    static FunctionResponse functionResponse(String name, Map<String, Object> response) {
        return new FunctionResponse(name, response);
    }

    /**
     * 从 Gemini 风格 JSON 解析
     *
     * @throws InvalidRequestException 无法识别的 part 形态
     */
    static Part fromJson(JSONObject json) {
        if (json == null) {
            throw new InvalidRequestException("part 不能为空");
        }
        if (json.containsKey("text")) {
            return new Text(json.getString("text"));
        }
        JSONObject inline = json.getJSONObject("inlineData");
        if (inline != null) {
            return new InlineData(inline.getString("mimeType"), inline.getString("data"));
        }
        JSONObject call = json.getJSONObject("functionCall");
        if (call != null) {
            return new FunctionCall(call.getString("name"), call.getJSONObject("args"));
        }
        JSONObject result = json.getJSONObject("functionResponse");
        if (result != null) {
            return new FunctionResponse(result.getString("name"), result.getJSONObject("response"));
        }
        throw new InvalidRequestException("无法识别的 part: " + json.toJSONString());
    }

    record Text(String text) implements Part {

        public Text {
            text = text != null ? text : "";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("text", text);
        }
    }

    record InlineData(String mimeType, String data) implements Part {

        public boolean isImage() {
            return mimeType != null && mimeType.startsWith("image/");
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("inlineData", JSONObject.of("mimeType", mimeType, "data", data));
        }
    }

    record FunctionCall(String name, Map<String, Object> args) implements Part {

        public FunctionCall {
            args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("functionCall", JSONObject.of("name", name, "args", new JSONObject(args)));
        }
    }

    record FunctionResponse(String name, Map<String, Object> response) implements Part {

        public FunctionResponse {
            response = response != null ? Collections.unmodifiableMap(new LinkedHashMap<>(response)) : null;
        }

        @Override
        public JSONObject toJson() {
            JSONObject body = new JSONObject();
            body.put("name", name);
            body.put("response", response != null ? new JSONObject(response) : null);
            return JSONObject.of("functionResponse", body);
        }
    }
}
