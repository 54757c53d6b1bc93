package com.ollama.gateway.translator.structured;

import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 结构化输出抽取器
 * <p>
 * Ollama 不能按 schema 约束输出，只能尽力从文本中找出 JSON：
 * 先清理思考块和代码围栏，再按顺序尝试各个策略，全部失败时按 schema 合成兜底值。
 * 永远返回一个值，不抛异常。
 */
@Component
public class StructuredOutputExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputExtractor.class);

    private final List<ExtractionStrategy> strategies;

    public StructuredOutputExtractor() {
        this(ExtractionStrategies.DEFAULT_CHAIN);
    }

    public StructuredOutputExtractor(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Object extract(String rawText, JSONObject schema) {
        String text = rawText != null ? rawText : "";
        ExtractionInput input = new ExtractionInput(text, ThinkTagCleaner.prepare(text));

        for (ExtractionStrategy strategy : strategies) {
            Optional<Object> value = strategy.extract(input);
            if (value.isPresent()) {
                return value.get();
            }
        }

        log.warn("无法从模型输出中解析 JSON, 使用 schema 兜底: {}", preview(text));
        Metrics.instance().increment("structured_fallback_total");
        return SchemaFallback.build(schema, text);
    }

    private static String preview(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
