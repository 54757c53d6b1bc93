package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 一轮对话：角色 + 有序的 part 列表
 *
 * @param role  user / model / system
 * @param parts 内容片段
 */
public record Content(String role, List<Part> parts) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";
    public static final String ROLE_SYSTEM = "system";

    public Content {
        role = role != null ? role : ROLE_USER;
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static Content of(String role, Part... parts) {
        return new Content(role, Arrays.asList(parts));
    }

    public static Content user(String text) {
        return of(ROLE_USER, Part.text(text));
    }

    public static Content model(String text) {
        return of(ROLE_MODEL, Part.text(text));
    }

    public static Content system(String text) {
        return of(ROLE_SYSTEM, Part.text(text));
    }

    public JSONObject toJson() {
        JSONArray partsJson = new JSONArray();
        for (Part part : parts) {
            partsJson.add(part.toJson());
        }
        return JSONObject.of("role", role, "parts", partsJson);
    }

    public static Content fromJson(JSONObject json) {
        if (json == null) {
            throw new InvalidRequestException("content 不能为空");
        }
        List<Part> parts = new ArrayList<>();
        JSONArray partsJson = json.getJSONArray("parts");
        if (partsJson != null) {
            for (int i = 0; i < partsJson.size(); i++) {
                parts.add(Part.fromJson(partsJson.getJSONObject(i)));
            }
        }
        return new Content(json.getString("role"), parts);
    }

    /**
     * 解析 contents 字段，兼容单个对象和数组两种写法
     */
    public static List<Content> listFromJson(Object contents) {
        if (contents == null) {
            return List.of();
        }
        if (contents instanceof JSONObject single) {
            return List.of(fromJson(single));
        }
        if (contents instanceof JSONArray arr) {
            List<Content> result = new ArrayList<>();
            for (int i = 0; i < arr.size(); i++) {
                result.add(fromJson(arr.getJSONObject(i)));
            }
            return result;
        }
        throw new InvalidRequestException("contents 必须是对象或数组");
    }
}
