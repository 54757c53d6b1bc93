package com.ollama.gateway.exception;

/**
 * 流式请求没有可读取的响应体
 */
public class MissingBodyException extends OllamaGatewayException {

    public MissingBodyException() {
        super("Ollama 流式响应没有响应体", 502);
    }
}
