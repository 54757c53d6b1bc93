package com.ollama.gateway.exception;

/**
 * 结构化输出请求返回了空文本
 * <p>
 * 与解析失败不同：解析失败由兜底链处理，空响应直接失败
 */
public class EmptyResponseException extends OllamaGatewayException {

    public EmptyResponseException(String message) {
        super(message, 502);
    }
}
