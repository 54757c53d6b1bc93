package com.ollama.gateway.dto.genai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成响应
 *
 * @param candidates    候选列表（网关始终只产生一个）
 * @param usageMetadata 用量，下游未返回计数时为 null
 */
public record GenerateContentResponse(List<Candidate> candidates, UsageMetadata usageMetadata) {

    public GenerateContentResponse {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public Candidate firstCandidate() {
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    /**
     * 第一个候选的全部文本
     */
    public String text() {
        Candidate candidate = firstCandidate();
        if (candidate == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Part part : candidate.content().parts()) {
            if (part instanceof Part.Text t) {
                sb.append(t.text());
            }
        }
        return sb.toString();
    }

    /**
     * 第一个候选中的函数调用
     */
    public List<Part.FunctionCall> functionCalls() {
        Candidate candidate = firstCandidate();
        if (candidate == null) {
            return List.of();
        }
        List<Part.FunctionCall> calls = new ArrayList<>();
        for (Part part : candidate.content().parts()) {
            if (part instanceof Part.FunctionCall call) {
                calls.add(call);
            }
        }
        return calls;
    }

    public JSONObject toJson() {
        JSONArray candidatesJson = new JSONArray();
        for (Candidate candidate : candidates) {
            candidatesJson.add(candidate.toJson());
        }
        JSONObject json = JSONObject.of("candidates", candidatesJson);
        if (usageMetadata != null) {
            json.put("usageMetadata", usageMetadata.toJson());
        }
        return json;
    }
}
