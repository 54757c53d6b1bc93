package com.ollama.gateway.dto.genai;

/**
 * 结束原因
 * <p>
 * Ollama 只有 done 标志，网关只会产生 STOP
 */
public enum FinishReason {
    STOP,
    MAX_TOKENS,
    OTHER
}
