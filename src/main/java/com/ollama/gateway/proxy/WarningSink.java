package com.ollama.gateway.proxy;

/**
 * 非致命警告的输出通道
 */
@FunctionalInterface
public interface WarningSink {

    void warn(String message);
}
