package com.nim.gateway.proxy;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.UpstreamApiException;
import com.nim.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * NVIDIA NIM API 客户端
 * <p>
 * 三类调用：模型探测、非流式补全、流式补全。
 * 全部基于 {@link HttpClient#sendAsync}，不阻塞请求线程；不做任何重试。
 */
@Component
public class UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

    private final HttpClient httpClient;
    private final AppProperties properties;
    private final URI endpoint;

    public UpstreamClient(HttpClient nimHttpClient, AppProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new IllegalStateException("FATAL: nim.api-key 未配置（环境变量 NIM_API_KEY）");
        }
        this.httpClient = nimHttpClient;
        this.properties = properties;
        this.endpoint = URI.create(trimTrailingSlash(properties.getApiBase()) + "/chat/completions");
    }

    /**
     * 探测模型名是否为 NIM 可用模型
     * <p>
     * 发送 max_tokens=1 的最小请求，短超时；任何失败都折叠为不可用，不抛出
     *
     * @param model 待探测的模型名
     * @return 探测结果，永不以错误结束
     */
    public Mono<ProbeResult> probe(String model) {
        JSONObject body = JSONObject.of(
                "model", model, //
                "messages", JSONArray.of(JSONObject.of("role", "user", "content", "test")), //
                "max_tokens", 1 //
        );
        Duration timeout = properties.getUpstream().getProbeTimeout();
        HttpRequest request = buildRequest(body, timeout);
        Metrics.instance().increment("probes_total");

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding()))
                .timeout(timeout)
                .map(response -> ProbeResult.ofStatus(response.statusCode()))
                .doOnNext(result -> {
                    if (!result.available()) {
                        log.warn("模型探测被拒绝: model={}, status={}", model, result.statusCode());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("模型探测失败: model={}, error={}", model, describe(e));
                    return Mono.just(ProbeResult.failed(describe(e)));
                });
    }

    /**
     * 非流式调用 chat/completions
     *
     * @param payload 上游请求体
     * @return 上游响应 JSON；非 2xx、网络错误、超时以 {@link UpstreamApiException} 结束
     */
    public Mono<JSONObject> complete(JSONObject payload) {
        HttpRequest request = buildRequest(payload, properties.getUpstream().getRequestTimeout());

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)))
                .map(response -> {
                    if (!isSuccess(response.statusCode())) {
                        throw new UpstreamApiException(response.statusCode(), response.body());
                    }
                    return JSONObject.parseObject(response.body());
                })
                .onErrorMap(e -> !(e instanceof UpstreamApiException),
                        e -> new UpstreamApiException(500, describe(e), e));
    }

    /**
     * 流式调用 chat/completions
     * <p>
     * 外层 Mono 在收到响应头后完成：非 2xx 时读完错误体并以 {@link UpstreamApiException} 结束，
     * 此时尚未向客户端写出任何数据。内层 Flux 为原始字节分片，取消订阅即中断上游连接。
     *
     * @param payload 上游请求体（stream=true）
     * @return 原始字节流
     */
    public Mono<Flux<byte[]>> openStream(JSONObject payload) {
        HttpRequest request = buildRequest(payload, properties.getUpstream().getRequestTimeout());

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofPublisher()))
                .onErrorMap(e -> new UpstreamApiException(500, describe(e), e))
                .flatMap(response -> {
                    Flux<byte[]> body = JdkFlowAdapter.flowPublisherToFlux(response.body())
                            .flatMapIterable(buffers -> buffers)
                            .map(UpstreamClient::toBytes);
                    if (isSuccess(response.statusCode())) {
                        return Mono.just(body);
                    }
                    return readAll(body).flatMap(errorBody ->
                            Mono.error(new UpstreamApiException(response.statusCode(), errorBody)));
                });
    }

    private HttpRequest buildRequest(JSONObject payload, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toJSONString(), StandardCharsets.UTF_8))
                .build();
    }

    private static Mono<String> readAll(Flux<byte[]> body) {
        return body.collectList().map(UpstreamClient::concat);
    }

    private static String concat(List<byte[]> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
