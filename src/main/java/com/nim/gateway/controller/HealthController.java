package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.util.Metrics;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查与指标端点
 */
@RestController
public class HealthController {

    private final AppProperties properties;

    public HealthController(AppProperties properties) {
        this.properties = properties;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        JSONObject result = new JSONObject();
        result.put("status", "ok");
        result.put("service", "OpenAI to NVIDIA NIM Proxy");
        result.put("reasoning_display", properties.getReasoning().isShow());
        result.put("thinking_mode", properties.getThinking().isEnabled());
        return Mono.just(result.toJSONString());
    }

    /**
     * Prometheus 指标
     */
    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> metrics() {
        return Mono.just(Metrics.instance().toPrometheusFormat());
    }
}
