package com.ollama.gateway.translator;

import com.ollama.gateway.dto.genai.Candidate;
import com.ollama.gateway.dto.genai.Content;
import com.ollama.gateway.dto.genai.FinishReason;
import com.ollama.gateway.dto.genai.GenerateContentResponse;
import com.ollama.gateway.dto.genai.Part;
import com.ollama.gateway.dto.genai.UsageMetadata;
import com.ollama.gateway.dto.ollama.OllamaChatResponse;
import com.ollama.gateway.dto.ollama.OllamaMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ollama 响应 → 生成响应
 * <p>
 * 纯转换，无 I/O。文本 part 在前，函数调用按原顺序在后。
 */
@Component
public class ResponseTranslator {

    private final ToolBridge toolBridge;

    public ResponseTranslator(ToolBridge toolBridge) {
        this.toolBridge = toolBridge;
    }

    public GenerateContentResponse translate(OllamaChatResponse response) {
        OllamaMessage message = response.message();
        List<Part> parts = new ArrayList<>();

        if (!message.content().isEmpty()) {
            parts.add(Part.text(message.content()));
        }
        parts.addAll(toolBridge.toFunctionCallParts(message.toolCalls()));

        // 未结束时不填 finishReason
        FinishReason finishReason = response.done() ? FinishReason.STOP : null;
        Candidate candidate = new Candidate(new Content(Content.ROLE_MODEL, parts), finishReason, 0);

        return new GenerateContentResponse(List.of(candidate), toUsage(response));
    }

    /**
     * 下游没有 eval_count 时不输出用量，不补零
     */
    private UsageMetadata toUsage(OllamaChatResponse response) {
        if (response.evalCount() == null) {
            return null;
        }
        int prompt = response.promptEvalCount() != null ? response.promptEvalCount() : 0;
        int candidates = response.evalCount();
        return new UsageMetadata(prompt, candidates, prompt + candidates);
    }
}
