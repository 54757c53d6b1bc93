package com.ollama.gateway.proxy;

import com.ollama.gateway.config.AppProperties;
import com.ollama.gateway.dto.ollama.OllamaChatRequest;
import com.ollama.gateway.dto.ollama.OllamaChatResponse;
import com.ollama.gateway.dto.ollama.OllamaEmbedRequest;
import com.ollama.gateway.dto.ollama.OllamaMessage;
import com.ollama.gateway.dto.ollama.OllamaModelList;
import com.ollama.gateway.exception.MissingBodyException;
import com.ollama.gateway.exception.OllamaApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OllamaApiClientTest {

    private HttpClient httpClient;
    private AppProperties properties;
    private OllamaApiClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        properties = new AppProperties();
        properties.setHost("http://ollama.local:11434/");
        client = new OllamaApiClient(httpClient, properties);
    }

    @Test
    void shouldPostChatToStrippedHostWithoutAuthorizationByDefault() throws Exception {
        HttpResponse<String> response = stringResponse(200, """
                {"model":"llama3.2","message":{"role":"assistant","content":"hi"},"done":true,"eval_count":1}
                """);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        OllamaChatResponse result = client.chat(chatRequest(false));

        assertThat(result.message().content()).isEqualTo("hi");
        assertThat(result.done()).isTrue();

        HttpRequest sent = captureRequest();
        assertThat(sent.uri().toString()).isEqualTo("http://ollama.local:11434/api/chat");
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(sent.headers().firstValue("Authorization")).isEmpty();
    }

    @Test
    void shouldSendBearerTokenWhenApiKeyConfigured() throws Exception {
        properties.setApiKey("secret-key");
        doReturn(stringResponse(200, "{\"message\":{\"content\":\"\"},\"done\":true}"))
                .when(httpClient).send(any(HttpRequest.class), any());

        client.chat(chatRequest(false));

        assertThat(captureRequest().headers().firstValue("Authorization")).hasValue("Bearer secret-key");
    }

    @Test
    void shouldThrowApiExceptionOnNonSuccessStatus() throws Exception {
        doReturn(stringResponse(404, "{\"error\":\"model 'llama3.2' not found\"}"))
                .when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.chat(chatRequest(false)))
                .isInstanceOfSatisfying(OllamaApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.isModelNotFound()).isTrue();
                    assertThat(e.getResponseBody()).contains("not found");
                });
    }

    @Test
    void shouldWrapIoFailureAs502() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.chat(chatRequest(false)))
                .isInstanceOfSatisfying(OllamaApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(502);
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
    }

    @Test
    void shouldRejectInvalidJsonBody() throws Exception {
        doReturn(stringResponse(200, "not json")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.chat(chatRequest(false)))
                .isInstanceOfSatisfying(OllamaApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(502));
    }

    @Test
    void shouldOpenStreamOverResponseBody() throws Exception {
        InputStream body = new ByteArrayInputStream("""
                {"message":{"content":"a"},"done":false}
                {"message":{"content":"b"},"done":true}
                """.getBytes(StandardCharsets.UTF_8));
        doReturn(streamResponse(200, body)).when(httpClient).send(any(HttpRequest.class), any());

        ChatResponseStream stream = client.chatStream(chatRequest(true));

        assertThat(stream.next().message().content()).isEqualTo("a");
        assertThat(stream.next().done()).isTrue();
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    void shouldFailStreamWithoutBody() throws Exception {
        doReturn(streamResponse(200, null)).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.chatStream(chatRequest(true))).isInstanceOf(MissingBodyException.class);
    }

    @Test
    void shouldFailStreamOnErrorStatusWithBodyText() throws Exception {
        InputStream body = new ByteArrayInputStream("boom".getBytes(StandardCharsets.UTF_8));
        doReturn(streamResponse(500, body)).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.chatStream(chatRequest(true)))
                .isInstanceOfSatisfying(OllamaApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.getResponseBody()).isEqualTo("boom");
                });
    }

    @Test
    void shouldReturnFirstEmbedding() throws Exception {
        doReturn(stringResponse(200, "{\"embeddings\":[[0.1,0.2,0.3],[9.0]]}"))
                .when(httpClient).send(any(HttpRequest.class), any());

        List<Double> vector = client.embed(new OllamaEmbedRequest("nomic-embed-text", "hello")).first();

        assertThat(vector).containsExactly(0.1, 0.2, 0.3);
        assertThat(captureRequest().uri().getPath()).isEqualTo("/api/embed");
    }

    @Test
    void shouldListModelsAsynchronously() {
        HttpResponse<String> response = stringResponse(200, "{\"models\":[{\"name\":\"llama3.2:latest\"},{\"name\":\"qwen2.5\"}]}");
        doReturn(CompletableFuture.completedFuture(response)).when(httpClient).sendAsync(any(HttpRequest.class), any());

        OllamaModelList models = client.listModels(Duration.ofSeconds(5)).join();

        assertThat(models.names()).containsExactly("llama3.2:latest", "qwen2.5");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), any());
        assertThat(captor.getValue().uri().getPath()).isEqualTo("/api/tags");
        assertThat(captor.getValue().method()).isEqualTo("GET");
        assertThat(captor.getValue().timeout()).hasValue(Duration.ofSeconds(5));
    }

    // ==================== 辅助方法 ====================

    private HttpRequest captureRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    private static OllamaChatRequest chatRequest(boolean stream) {
        return new OllamaChatRequest("llama3.2", List.of(OllamaMessage.of("user", "hi")), stream, null, null, null);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> stringResponse(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<InputStream> streamResponse(int status, InputStream body) {
        HttpResponse<InputStream> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
