package com.nim.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

/**
 * 全局异常处理器
 * <p>
 * 统一输出 OpenAI 风格错误体：{"error":{"message","type","code"}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<String> handleInvalidRequest(InvalidRequestException e) {
        log.warn("非法请求: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "invalid_request_error", e.getMessage());
    }

    @ExceptionHandler(UpstreamApiException.class)
    public ResponseEntity<String> handleUpstream(UpstreamApiException e) {
        log.error("NIM API 异常: status={}, body={}", e.getStatusCode(), e.getResponseBody());
        Metrics.instance().increment("upstream_errors");
        return buildErrorResponse(e.getStatusCode(), "api_error", e.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "api_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e, ServerWebExchange exchange) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            String path = exchange.getRequest().getPath().value();
            log.warn("路由未找到: {}", path);
            return buildErrorResponse(404, "invalid_request_error", "Endpoint " + path + " not found");
        }
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        String message = e.getReason() != null ? e.getReason() : e.getMessage();
        return buildErrorResponse(statusCode, "invalid_request_error", message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "api_error", e.getMessage() != null ? e.getMessage() : "Internal server error");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        int status = statusCode >= 400 && statusCode <= 599 ? statusCode : 500;
        JSONObject body = JSONObject.of(
                "error", JSONObject.of( //
                        "message", message, //
                        "type", errorType, //
                        "code", status //
                ) //
        );
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
