package com.ollama.gateway.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 网关指标，按 Prometheus 文本格式输出
 * <p>
 * 只有计数器：下游调用次数、各操作累计耗时、Token 用量、流解码失败与结构化兜底次数。
 * 耗时以 {@code _latency_ms_sum} / {@code _latency_ms_count} 成对暴露，平均值由抓取端计算
 */
public class Metrics {

    private static final Metrics INSTANCE = new Metrics();
    private static final String PREFIX = "ollama_gateway_";

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public static Metrics instance() {
        return INSTANCE;
    }

    public void increment(String name) {
        add(name, 1);
    }

    public void add(String name, long value) {
        counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(value);
    }

    /**
     * 未出现过的计数器返回 0
     */
    public long get(String name) {
        AtomicLong counter = counters.get(name);
        return counter == null ? 0 : counter.get();
    }

    /**
     * 记录一次对 Ollama 的调用
     *
     * @param operation generate / stream / embed / json
     * @param latencyMs 从发起到结束（流式为流关闭）的毫秒数
     */
    public void recordRequest(String operation, boolean success, long latencyMs) {
        increment("requests_total");
        increment("requests_" + operation);
        increment(success ? "requests_success" : "requests_error");
        add(operation + "_latency_ms_sum", Math.max(latencyMs, 0));
        increment(operation + "_latency_ms_count");
    }

    /**
     * 记录 Ollama 报告的 prompt_eval_count / eval_count
     */
    public void recordTokens(int promptTokens, int completionTokens) {
        add("tokens_prompt_total", promptTokens);
        add("tokens_completion_total", completionTokens);
    }

    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();
        // 按名称排序，输出稳定
        new TreeMap<>(counters).forEach((name, value) -> {
            String metric = PREFIX + name;
            sb.append("# TYPE ").append(metric).append(" counter\n");
            sb.append(metric).append(' ').append(value.get()).append('\n');
        });
        return sb.toString();
    }
}
