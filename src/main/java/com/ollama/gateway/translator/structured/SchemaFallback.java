package com.ollama.gateway.translator.structured;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 所有抽取策略都失败时，按 schema 的顶层属性合成一个值
 */
public final class SchemaFallback {

    static final String NEXT_SPEAKER = "next_speaker";
    static final String REASONING = "reasoning";
    static final int STRING_PREVIEW_LENGTH = 100;

    private SchemaFallback() {
    }

    public static JSONObject build(JSONObject schema, String rawText) {
        Object rawProperties = schema != null ? schema.get("properties") : null;
        if (!(rawProperties instanceof JSONObject properties)) {
            return JSONObject.of("response", rawText);
        }

        if (properties.keySet().equals(Set.of(NEXT_SPEAKER, REASONING))) {
            return inferNextSpeaker(rawText);
        }

        String lower = rawText.toLowerCase(Locale.ROOT);
        JSONObject result = new JSONObject();
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            Object value = null;
            if (entry.getValue() instanceof JSONObject property) {
                String type = property.getString("type");
                if ("string".equals(type)) {
                    Object enumValues = property.get("enum");
                    value = enumValues instanceof JSONArray values && !values.isEmpty()
                            ? values.get(0)
                            : rawText.substring(0, Math.min(STRING_PREVIEW_LENGTH, rawText.length()));
                } else if ("boolean".equals(type)) {
                    value = lower.contains("true") || lower.contains("yes");
                }
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }

    /**
     * 根据短语判断下一个发言者，无法判断时默认 user
     */
    static JSONObject inferNextSpeaker(String rawText) {
        String lower = rawText.toLowerCase(Locale.ROOT);
        String speaker = "user";
        String reasoning = "Unable to parse response, defaulting to user turn";

        if (lower.contains("model should speak next")
                || lower.contains("model continues")
                || lower.contains("'model'")) {
            speaker = "model";
            reasoning = "Model indicated it should continue";
        } else if (lower.contains("user should speak next")
                || lower.contains("question to user")
                || lower.contains("'user'")) {
            reasoning = "Response indicates user should speak next";
        }

        return JSONObject.of(NEXT_SPEAKER, speaker, REASONING, reasoning);
    }
}
