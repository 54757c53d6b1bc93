package com.ollama.gateway.translator.structured;

import java.util.Optional;

/**
 * 单个 JSON 抽取策略
 * <p>
 * 纯函数，失败时返回 empty，不抛异常
 */
@FunctionalInterface
public interface ExtractionStrategy {

    Optional<Object> extract(ExtractionInput input);
}
