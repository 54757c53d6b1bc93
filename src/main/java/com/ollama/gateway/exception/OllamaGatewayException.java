package com.ollama.gateway.exception;

import lombok.Getter;

/**
 * Ollama Gateway 异常基类
 */
@Getter
public class OllamaGatewayException extends RuntimeException {

    private final int statusCode;

    public OllamaGatewayException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public OllamaGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OllamaGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public OllamaGatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
