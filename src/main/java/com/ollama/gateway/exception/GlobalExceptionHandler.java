package com.ollama.gateway.exception;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 错误体沿用 Gemini 风格：{"error":{"code","status","message"}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<String> handleInvalidRequest(InvalidRequestException e) {
        log.warn("请求格式错误: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(JSONException.class)
    public ResponseEntity<String> handleMalformedJson(JSONException e) {
        log.warn("请求 JSON 解析失败: {}", e.getMessage());
        return buildErrorResponse(400, "INVALID_ARGUMENT", "请求体不是合法的 JSON");
    }

    @ExceptionHandler(OllamaApiException.class)
    public ResponseEntity<String> handleOllamaApi(OllamaApiException e) {
        log.error("Ollama API 异常: operation={}, status={}, body={}",
                e.getOperation(), e.getStatusCode(), e.getResponseBody());
        return buildErrorResponse(e.getStatusCode(), "UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(OllamaGatewayException.class)
    public ResponseEntity<String> handleGateway(OllamaGatewayException e) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "INTERNAL", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
        } else {
            log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        }
        return buildErrorResponse(statusCode, statusCode == 404 ? "NOT_FOUND" : "FAILED_PRECONDITION", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "INTERNAL", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String status, String message) {
        // 下游可能返回非标准状态码
        int httpStatus = statusCode >= 400 && statusCode <= 599 ? statusCode : 502;
        JSONObject body = JSONObject.of(
                "error", JSONObject.of( //
                        "code", httpStatus, //
                        "status", status, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(httpStatus)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
