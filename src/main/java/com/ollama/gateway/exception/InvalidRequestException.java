package com.ollama.gateway.exception;

/**
 * 客户端请求格式错误
 */
public class InvalidRequestException extends OllamaGatewayException {

    public InvalidRequestException(String message) {
        super(message, 400);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
