package com.nim.gateway.proxy;

/**
 * 模型探测结果
 *
 * @param available  上游是否接受该模型名（2xx）
 * @param statusCode 上游状态码，网络错误/超时时为 0
 * @param reason     失败原因，成功时为 null
 */
public record ProbeResult(boolean available, int statusCode, String reason) {

    public static ProbeResult ofStatus(int statusCode) {
        boolean ok = statusCode >= 200 && statusCode < 300;
        return new ProbeResult(ok, statusCode, ok ? null : "HTTP " + statusCode);
    }

    public static ProbeResult failed(String reason) {
        return new ProbeResult(false, 0, reason);
    }
}
