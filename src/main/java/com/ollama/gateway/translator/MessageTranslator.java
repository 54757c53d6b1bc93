package com.ollama.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.ollama.gateway.dto.genai.Content;
import com.ollama.gateway.dto.genai.Part;
import com.ollama.gateway.dto.ollama.OllamaMessage;
import com.ollama.gateway.dto.ollama.OllamaToolCall;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 对话内容 → Ollama 消息
 * <p>
 * Ollama 没有 tool 角色，函数结果以文本形式拼进同一条消息
 */
@Component
public class MessageTranslator {

    private final ToolBridge toolBridge;

    public MessageTranslator(ToolBridge toolBridge) {
        this.toolBridge = toolBridge;
    }

    /**
     * 转换对话，空 part 的轮次直接丢弃
     */
    public List<OllamaMessage> translate(List<Content> contents) {
        List<OllamaMessage> messages = new ArrayList<>();
        if (contents == null) {
            return messages;
        }

        for (Content content : contents) {
            if (content.parts().isEmpty()) {
                continue;
            }

            StringBuilder text = new StringBuilder();
            List<String> images = new ArrayList<>();
            List<OllamaToolCall> toolCalls = new ArrayList<>();

            for (Part part : content.parts()) {
                if (part instanceof Part.Text t) {
                    text.append(t.text());
                } else if (part instanceof Part.InlineData inline) {
                    // 非图片二进制直接丢弃
                    if (inline.isImage() && inline.data() != null) {
                        images.add(inline.data());
                    }
                } else if (part instanceof Part.FunctionCall call) {
                    toolCalls.add(toolBridge.toToolCall(call));
                } else if (part instanceof Part.FunctionResponse result) {
                    String name = result.name() != null ? result.name() : "unknown";
                    text.append("Function ").append(name).append(" returned: ")
                            .append(JSON.toJSONString(result.response(), JSONWriter.Feature.WriteMapNullValue));
                }
            }

            messages.add(new OllamaMessage(mapRole(content.role()), text.toString(), images, toolCalls));
        }
        return messages;
    }

    /**
     * model → assistant，其余角色原样保留
     */
    public static String mapRole(String role) {
        return Content.ROLE_MODEL.equals(role) ? "assistant" : role;
    }
}
