package com.ollama.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.ollama.gateway.dto.genai.FunctionDeclaration;
import com.ollama.gateway.dto.genai.Part;
import com.ollama.gateway.dto.genai.Tool;
import com.ollama.gateway.dto.ollama.OllamaTool;
import com.ollama.gateway.dto.ollama.OllamaToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 工具声明与工具调用的双向转换
 * <p>
 * Ollama 每个工具条目只能携带一个函数，因此一组声明只取第一个
 */
@Component
public class ToolBridge {

    private static final Logger log = LoggerFactory.getLogger(ToolBridge.class);

    /**
     * 工具组 → Ollama 工具列表
     */
    public List<OllamaTool> toOllamaTools(List<Tool> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        List<OllamaTool> result = new ArrayList<>();
        for (Tool tool : tools) {
            List<FunctionDeclaration> declarations = tool.functionDeclarations();
            if (declarations.isEmpty()) {
                continue;
            }
            if (declarations.size() > 1) {
                log.debug("工具组包含 {} 个函数声明, 仅转换第一个: {}", declarations.size(), declarations.get(0).name());
            }
            FunctionDeclaration first = declarations.get(0);
            result.add(new OllamaTool(first.name(), first.description(), first.parameters()));
        }
        return result;
    }

    /**
     * 函数调用 part → Ollama 工具调用
     */
    public OllamaToolCall toToolCall(Part.FunctionCall call) {
        return OllamaToolCall.function(call.name(), JSON.toJSONString(call.args(), JSONWriter.Feature.WriteMapNullValue));
    }

    /**
     * Ollama 工具调用 → 函数调用 part，非 function 类型忽略
     */
    public List<Part> toFunctionCallParts(List<OllamaToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        List<Part> parts = new ArrayList<>();
        for (OllamaToolCall toolCall : toolCalls) {
            if (!toolCall.isFunction()) {
                log.debug("忽略非 function 类型的工具调用: type={}", toolCall.type());
                continue;
            }
            parts.add(Part.functionCall(toolCall.name(), parseArguments(toolCall)));
        }
        return parts;
    }

    /**
     * 参数解析失败时返回空 map，不让整个响应失败
     */
    private Map<String, Object> parseArguments(OllamaToolCall toolCall) {
        try {
            JSONObject args = JSON.parseObject(toolCall.arguments());
            return args != null ? args : Map.of();
        } catch (Exception e) {
            log.warn("工具调用参数不是合法 JSON 对象: name={}, arguments={}", toolCall.name(), toolCall.arguments());
            return Map.of();
        }
    }
}
