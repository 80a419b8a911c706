package com.nim.gateway.exception;

import lombok.Getter;

/**
 * NIM 上游调用异常
 * <p>
 * 非 2xx 时携带上游状态码；网络错误、超时统一为 500
 */
@Getter
public class UpstreamApiException extends GatewayException {

    private final String responseBody;

    public UpstreamApiException(int statusCode, String responseBody) {
        super("NIM API 错误: " + statusCode + " - " + responseBody, statusCode);
        this.responseBody = responseBody;
    }

    public UpstreamApiException(int statusCode, String responseBody, Throwable cause) {
        super("NIM API 错误: " + statusCode + " - " + responseBody, statusCode, cause);
        this.responseBody = responseBody;
    }
}
