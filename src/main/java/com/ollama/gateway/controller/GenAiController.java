package com.ollama.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.ollama.gateway.dto.genai.CountTokensRequest;
import com.ollama.gateway.dto.genai.EmbedContentRequest;
import com.ollama.gateway.dto.genai.GenerateContentRequest;
import com.ollama.gateway.dto.genai.GenerateContentResponse;
import com.ollama.gateway.dto.genai.GenerateJsonRequest;
import com.ollama.gateway.exception.InvalidRequestException;
import com.ollama.gateway.service.ContentGenerator;
import com.ollama.gateway.service.GenerateContentStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Gemini 风格 API 端点
 * <p>
 * POST /v1beta/models/{model}:generateContent         非流式
 * POST /v1beta/models/{model}:streamGenerateContent   SSE 流式
 * POST /v1beta/models/{model}:embedContent            向量化
 * POST /v1beta/models/{model}:countTokens             Token 估算
 * POST /v1beta/models/{model}:generateJson            结构化输出
 */
@RestController
@RequestMapping("/v1beta/models")
public class GenAiController {

    private static final Logger log = LoggerFactory.getLogger(GenAiController.class);

    private final ContentGenerator generator;

    public GenAiController(ContentGenerator generator) {
        this.generator = generator;
    }

    /**
     * 路径段形如 llama3.2:generateContent，最后一个冒号之后是操作名
     */
    @PostMapping("/{target}")
    public Mono<Void> dispatch(@PathVariable("target") String target,
                               @RequestBody String body,
                               ServerWebExchange exchange) {
        int idx = target.lastIndexOf(':');
        if (idx < 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "缺少操作名: " + target);
        }
        String model = target.substring(0, idx);
        String action = target.substring(idx + 1);
        JSONObject request = parseBody(body);
        log.info("收到请求: model={}, action={}", model, action);

        return switch (action) {
            case "generateContent" -> writeJson(exchange,
                    () -> generator.generateContent(GenerateContentRequest.fromJson(request, model)).toJson().toJSONString());
            case "streamGenerateContent" -> writeStream(exchange, GenerateContentRequest.fromJson(request, model));
            case "embedContent" -> writeJson(exchange,
                    () -> generator.embedContent(EmbedContentRequest.fromJson(request, model)).toJson().toJSONString());
            case "countTokens" -> writeJson(exchange,
                    () -> generator.countTokens(CountTokensRequest.fromJson(request)).toJson().toJSONString());
            case "generateJson" -> {
                GenerateJsonRequest jsonRequest = GenerateJsonRequest.fromJson(request);
                yield writeJson(exchange, () -> JSON.toJSONString(
                        generator.generateJson(jsonRequest.contents(), jsonRequest.schema(), jsonRequest.generationConfig()),
                        JSONWriter.Feature.WriteMapNullValue));
            }
            default -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "未知操作: " + action);
        };
    }

    // ==================== 流式响应 ====================

    /**
     * 每条响应一个 SSE 事件；客户端断开或出错时关闭下游流
     */
    private Mono<Void> writeStream(ServerWebExchange exchange, GenerateContentRequest request) {
        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        Flux<String> events = Flux.using(
                        () -> generator.generateContentStream(request),
                        stream -> Flux.fromIterable(asIterable(stream))
                                .map(response -> "data: " + response.toJson().toJSONString() + "\n\n"),
                        this::closeStream)
                .subscribeOn(Schedulers.boundedElastic());

        exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        exchange.getResponse().getHeaders().setCacheControl("no-cache");
        return exchange.getResponse().writeAndFlushWith(
                events.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
        );
    }

    private static Iterable<GenerateContentResponse> asIterable(GenerateContentStream stream) {
        return () -> stream;
    }

    private void closeStream(GenerateContentStream stream) {
        log.debug("流式响应结束: chunks={}", stream.count());
        stream.close();
    }

    // ==================== 非流式响应 ====================

    /**
     * 阻塞调用放到 boundedElastic 上执行，直接写 JSON 字节
     */
    private Mono<Void> writeJson(ServerWebExchange exchange, Callable<String> call) {
        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(json -> {
                    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    exchange.getResponse().getHeaders().setContentLength(bytes.length);
                    DataBuffer buffer = bufferFactory.wrap(bytes);
                    return exchange.getResponse().writeWith(Mono.just(buffer));
                });
    }

    private static JSONObject parseBody(String body) {
        JSONObject request = JSONObject.parseObject(body);
        if (request == null) {
            throw new InvalidRequestException("请求体不能为空");
        }
        return request;
    }
}
