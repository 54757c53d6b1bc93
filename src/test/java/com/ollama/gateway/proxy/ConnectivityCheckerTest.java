package com.ollama.gateway.proxy;

import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.dto.ollama.OllamaModelList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectivityCheckerTest {

    private OllamaApiClient apiClient;
    private AppProperties properties;
    private final List<String> warnings = new ArrayList<>();
    private ConnectivityChecker checker;

    @BeforeEach
    void setUp() {
        apiClient = mock(OllamaApiClient.class);
        properties = new AppProperties();
        checker = new ConnectivityChecker(apiClient, properties, warnings::add);
    }

    @Test
    void shouldStartAsPending() {
        assertThat(checker.lastReport().status()).isEqualTo(ConnectivityReport.Status.PENDING);
        assertThat(checker.lastReport().isHealthy()).isFalse();
    }

    @Test
    void shouldReportOkWhenModelPresentWithLatestTag() {
        when(apiClient.listModels(any())).thenReturn(
                CompletableFuture.completedFuture(new OllamaModelList(List.of("llama3.2:latest", "qwen2.5"))));

        ConnectivityReport report = checker.checkAsync().join();

        assertThat(report.status()).isEqualTo(ConnectivityReport.Status.OK);
        assertThat(report.availableModels()).containsExactly("llama3.2:latest", "qwen2.5");
        assertThat(checker.lastReport()).isSameAs(report);
        assertThat(warnings).isEmpty();
        verify(apiClient).listModels(Duration.ofSeconds(5));
    }

    @Test
    void shouldWarnWhenModelMissing() {
        when(apiClient.listModels(any())).thenReturn(
                CompletableFuture.completedFuture(new OllamaModelList(List.of("qwen2.5"))));

        ConnectivityReport report = checker.checkAsync().join();

        assertThat(report.status()).isEqualTo(ConnectivityReport.Status.MODEL_MISSING);
        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0)).contains("llama3.2").contains("qwen2.5");
        assertThat(warnings.get(1)).isEqualTo("拉取模型: ollama pull llama3.2");
    }

    @Test
    void shouldCompleteNormallyWhenOllamaUnreachable() {
        when(apiClient.listModels(any())).thenReturn(
                CompletableFuture.failedFuture(new ConnectException("Connection refused")));

        ConnectivityReport report = checker.checkAsync().join();

        assertThat(report.status()).isEqualTo(ConnectivityReport.Status.UNREACHABLE);
        assertThat(report.message()).contains("http://localhost:11434").contains("Connection refused");
        assertThat(warnings).isNotEmpty();
    }

    @Test
    void shouldAbsorbSynchronousFailure() {
        when(apiClient.listModels(any())).thenThrow(new IllegalArgumentException("bad uri"));

        ConnectivityReport report = checker.checkAsync().join();

        assertThat(report.status()).isEqualTo(ConnectivityReport.Status.UNREACHABLE);
        assertThat(report.message()).contains("bad uri");
    }

    @Test
    void shouldAbsorbMissingFuture() {
        when(apiClient.listModels(any())).thenReturn(null);

        assertThat(checker.checkAsync().join().status()).isEqualTo(ConnectivityReport.Status.UNREACHABLE);
    }
}
