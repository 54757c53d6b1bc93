package com.ollama.gateway.exception;

import lombok.Getter;

/**
 * Ollama API 调用异常（非 2xx 状态或传输失败）
 */
@Getter
public class OllamaApiException extends OllamaGatewayException {

    private final String operation;
    private final String responseBody;

    public OllamaApiException(String operation, int statusCode, String responseBody) {
        super("Ollama " + operation + " 错误: " + statusCode + " " + responseBody, statusCode);
        this.operation = operation;
        this.responseBody = responseBody;
    }

    public OllamaApiException(String operation, int statusCode, String responseBody, Throwable cause) {
        super("Ollama " + operation + " 错误: " + statusCode + " " + responseBody, statusCode, cause);
        this.operation = operation;
        this.responseBody = responseBody;
    }

    public boolean isModelNotFound() {
        return getStatusCode() == 404;
    }
}
