package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.InvalidRequestException;
import com.nim.gateway.model.ModelAlias;
import com.nim.gateway.model.ModelResolver;
import com.nim.gateway.proxy.UpstreamClient;
import com.nim.gateway.translator.RequestTranslator;
import com.nim.gateway.translator.ResponseBuilder;
import com.nim.gateway.translator.StreamTransformer;
import com.nim.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions — 流式 + 非流式
 * GET  /v1/models            — 别名模型列表
 */
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private static final Logger log = LoggerFactory.getLogger(OpenAiController.class);

    static final String MESSAGES_REQUIRED = "'messages' is required and must be a non-empty array";

    private final ModelResolver modelResolver;
    private final RequestTranslator translator;
    private final ResponseBuilder responseBuilder;
    private final UpstreamClient upstreamClient;
    private final AppProperties properties;

    public OpenAiController(ModelResolver modelResolver, RequestTranslator translator,
                            ResponseBuilder responseBuilder, UpstreamClient upstreamClient,
                            AppProperties properties) {
        this.modelResolver = modelResolver;
        this.translator = translator;
        this.responseBuilder = responseBuilder;
        this.upstreamClient = upstreamClient;
        this.properties = properties;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody(required = false) String body, ServerWebExchange exchange) {
        JSONObject request = parseRequest(body);
        boolean stream = parseStreamFlag(request);
        long startTime = System.currentTimeMillis();

        return modelResolver.resolve(request.getString("model"))
                .flatMap(resolved -> {
                    JSONObject payload = translator.translate(request, resolved.backendModel(), resolved.thinking());
                    if (stream) {
                        return streamResponse(payload, exchange, startTime);
                    }
                    return nonStreamResponse(payload, resolved, exchange, startTime);
                })
                .doOnError(e -> Metrics.instance().recordRequest(stream, false, System.currentTimeMillis() - startTime));
    }

    /**
     * GET /v1/models
     */
    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> listModels() {
        long created = System.currentTimeMillis() / 1000;
        JSONArray data = new JSONArray();
        for (ModelAlias alias : modelResolver.listAliases()) {
            data.add(JSONObject.of(
                    "id", alias.publicName(), //
                    "object", "model", //
                    "created", created, //
                    "owned_by", "nvidia-nim-proxy" //
            ));
        }
        return Mono.just(JSONObject.of("object", "list", "data", data).toJSONString());
    }

    // ==================== 流式响应 ====================

    private Mono<Void> streamResponse(JSONObject payload, ServerWebExchange exchange, long startTime) {
        // 上游非 2xx 在此之前以异常结束，响应头尚未写出，由全局异常处理器返回错误状态
        return upstreamClient.openStream(payload).flatMap(upstream -> {
            ServerHttpResponse response = exchange.getResponse();
            response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
            response.getHeaders().setCacheControl("no-cache");

            StreamTransformer transformer = new StreamTransformer(properties.getReasoning().isShow());
            Flux<String> events = upstream
                    .concatMapIterable(transformer::next)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(transformer.finish())))
                    .doOnComplete(() -> Metrics.instance().recordRequest(true, true, System.currentTimeMillis() - startTime))
                    .doOnCancel(() -> log.info("客户端断开，中断上游流"))
                    .onErrorResume(e -> {
                        // 响应头已发出，只能结束流
                        log.error("上游流异常: {}", e.getMessage());
                        Metrics.instance().recordRequest(true, false, System.currentTimeMillis() - startTime);
                        return Flux.empty();
                    });

            DataBufferFactory bufferFactory = response.bufferFactory();
            return response.writeAndFlushWith(
                    events.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
            );
        });
    }

    // ==================== 非流式响应 ====================

    private Mono<Void> nonStreamResponse(JSONObject payload, ModelResolver.ResolveResult resolved,
                                         ServerWebExchange exchange, long startTime) {
        return upstreamClient.complete(payload)
                .map(upstream -> responseBuilder.build(resolved.requestedModel(), upstream, resolved.thinking())
                        .toJSONString(JSONWriter.Feature.WriteNulls))
                .flatMap(json -> {
                    Metrics.instance().recordRequest(false, true, System.currentTimeMillis() - startTime);
                    ServerHttpResponse response = exchange.getResponse();
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    response.getHeaders().setContentLength(bytes.length);
                    return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
                });
    }

    private JSONObject parseRequest(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException(MESSAGES_REQUIRED);
        }
        JSONObject request;
        try {
            request = JSONObject.parseObject(body);
        } catch (Exception e) {
            throw new InvalidRequestException("Request body is not a valid JSON object", e);
        }
        if (request == null) {
            throw new InvalidRequestException("Request body is not a valid JSON object");
        }
        if (!(request.get("messages") instanceof JSONArray messages) || messages.isEmpty()) {
            throw new InvalidRequestException(MESSAGES_REQUIRED);
        }
        return request;
    }

    private boolean parseStreamFlag(JSONObject request) {
        Object value = request.get("stream");
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean stream) {
            return stream;
        }
        throw new InvalidRequestException("'stream' must be a boolean");
    }
}
