package com.ollama.gateway.controller;

import com.ollama.gateway.proxy.ConnectivityChecker;
import com.ollama.gateway.proxy.ConnectivityReport;
import com.ollama.gateway.util.Metrics;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Prometheus 指标端点
 * <p>
 * 计数器之外附加一个 Ollama 连通性 gauge（1 = 可用，0 = 不可用或检查未完成）
 */
@RestController
public class MetricsController {

    private final ConnectivityChecker connectivityChecker;

    public MetricsController(ConnectivityChecker connectivityChecker) {
        this.connectivityChecker = connectivityChecker;
    }

    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> metrics() {
        ConnectivityReport report = connectivityChecker.lastReport();
        String gauge = "# TYPE ollama_gateway_connectivity_up gauge\n"
                + "ollama_gateway_connectivity_up " + (report.isHealthy() ? 1 : 0) + "\n";
        return Mono.just(Metrics.instance().toPrometheusFormat() + gauge);
    }
}
