package com.nim.gateway.exception;

/**
 * 客户端请求非法（缺少 messages、请求体不是 JSON 等）
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message, 400);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
