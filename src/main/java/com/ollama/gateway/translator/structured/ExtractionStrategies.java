package com.ollama.gateway.translator.structured;

import com.alibaba.fastjson2.JSON;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内置抽取策略，按 {@link #DEFAULT_CHAIN} 的顺序尝试
 */
public final class ExtractionStrategies {

    // 单层对象，且至少有一个带引号的 key
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*\"[^\"]+\"\\s*:[^{}]*\\}");
    private static final ObjectMapper STRICT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final Pattern NEXT_SPEAKER_OBJECT = Pattern.compile("\\{[^<]*?\"next_speaker\"[^<]*?\\}");

    /**
     * 整段文本就是一个对象
     */
    public static final ExtractionStrategy DIRECT_OBJECT = input -> {
        String text = input.workingText().trim();
        if (!text.isEmpty() && text.startsWith("{") && text.endsWith("}")) {
            return tryParse(text);
        }
        return Optional.empty();
    };

    /**
     * 文本中嵌着的第一个单层对象
     */
    public static final ExtractionStrategy FLAT_OBJECT_MATCH = input -> {
        Matcher matcher = FLAT_OBJECT.matcher(input.workingText());
        return matcher.find() ? tryParse(matcher.group()) : Optional.empty();
    };

    /**
     * 第一个 { 到最后一个 } 之间的内容
     */
    public static final ExtractionStrategy BRACE_SPAN = input -> {
        String text = input.workingText();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start != -1 && end > start) {
            return tryParse(text.substring(start, end + 1));
        }
        return Optional.empty();
    };

    /**
     * 在未清理的原文里找含 next_speaker 的对象
     */
    public static final ExtractionStrategy NEXT_SPEAKER_IN_RAW = input -> {
        Matcher matcher = NEXT_SPEAKER_OBJECT.matcher(input.rawText());
        return matcher.find() ? tryParse(matcher.group()) : Optional.empty();
    };

    public static final List<ExtractionStrategy> DEFAULT_CHAIN =
            List.of(DIRECT_OBJECT, FLAT_OBJECT_MATCH, BRACE_SPAN, NEXT_SPEAKER_IN_RAW);

    private ExtractionStrategies() {
    }

    /**
     * 只接受严格 JSON 对象
     * <p>
     * fastjson2 默认放行单引号、未加引号的 key 等写法，先用 Jackson 校验一遍再交给 fastjson2 解析
     */
    static Optional<Object> tryParse(String text) {
        try {
            JsonNode node = STRICT_MAPPER.readTree(text);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.ofNullable(JSON.parseObject(text));
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
