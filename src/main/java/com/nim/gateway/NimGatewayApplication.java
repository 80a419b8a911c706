package com.nim.gateway;

import com.nim.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class NimGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(NimGatewayApplication.class);

    private final AppProperties properties;

    public NimGatewayApplication(AppProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(NimGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║             NIM Gateway Java v1.0.0               ║");
        log.info("║        OpenAI Compatible Proxy for NVIDIA NIM     ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("上游: {}", properties.getApiBase());
        log.info("Reasoning: {} | Thinking: {}", properties.getReasoning().isShow(), properties.getThinking().isEnabled());
        log.info("API 端点:");
        log.info("  POST /v1/chat/completions");
        log.info("  GET  /v1/models");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}
