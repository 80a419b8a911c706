package com.nim.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import com.nim.gateway.exception.GlobalExceptionHandler;
import com.nim.gateway.exception.UpstreamApiException;
import com.nim.gateway.model.AliasTable;
import com.nim.gateway.model.ModelResolver;
import com.nim.gateway.proxy.ProbeResult;
import com.nim.gateway.proxy.UpstreamClient;
import com.nim.gateway.support.TestProperties;
import com.nim.gateway.translator.OpenAiTranslator;
import com.nim.gateway.translator.ResponseBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OpenAiControllerTest {

    private static final String UPSTREAM_RESPONSE = "{\"id\":\"nim-1\",\"model\":\"deepseek-ai/deepseek-v3.1\","
            + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"<think>\\nhmm\\n</think>\\n\\nHello\"},"
            + "\"finish_reason\":\"stop\"}],\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":1,\"total_tokens\":4}}";

    private AppProperties properties;
    private UpstreamClient upstreamClient;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        properties = TestProperties.defaults();
        upstreamClient = mock(UpstreamClient.class);
        ModelResolver resolver = new ModelResolver(new AliasTable(properties), upstreamClient, properties);
        OpenAiController controller = new OpenAiController(resolver, new OpenAiTranslator(properties),
                new ResponseBuilder(properties), upstreamClient, properties);

        client = WebTestClient
                .bindToController(controller, new HealthController(properties), new NotFoundController())
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void rejectsRequestWithoutMessages() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo(OpenAiController.MESSAGES_REQUIRED)
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.code").isEqualTo(400);

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void rejectsNonJsonBody() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void rejectsNonBooleanStreamFlag() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"stream\":\"yes\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("'stream' must be a boolean")
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void translatesNonStreamingCompletion() {
        when(upstreamClient.complete(any())).thenReturn(Mono.just(JSONObject.parseObject(UPSTREAM_RESPONSE)));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.model").isEqualTo("gpt-4o")
                .jsonPath("$.choices[0].message.content").isEqualTo("Hello")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("stop")
                .jsonPath("$.usage.total_tokens").isEqualTo(4);

        ArgumentCaptor<JSONObject> payload = ArgumentCaptor.forClass(JSONObject.class);
        verify(upstreamClient).complete(payload.capture());
        assertThat(payload.getValue().getString("model")).isEqualTo("deepseek-ai/deepseek-v3.1");
        assertThat(payload.getValue().containsKey("chat_template_kwargs")).isFalse();
        verify(upstreamClient, never()).probe(anyString());
    }

    @Test
    void streamsReframedEvents() {
        String upstream = "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"reasoning_content\":\"why\"}}]}\n\n"
                + "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"ok\"}}]}\n\n"
                + "data: [DONE]\n\n";
        when(upstreamClient.openStream(any()))
                .thenReturn(Mono.just(Flux.just(upstream.getBytes(StandardCharsets.UTF_8))));

        String body = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertThat(body).doesNotContain("reasoning_content").doesNotContain("why");
        assertThat(body).contains("\"content\":\"ok\"").endsWith("data: [DONE]\n\n");

        ArgumentCaptor<JSONObject> payload = ArgumentCaptor.forClass(JSONObject.class);
        verify(upstreamClient).openStream(payload.capture());
        assertThat(payload.getValue().getBooleanValue("stream")).isTrue();
        assertThat(payload.getValue().getJSONObject("chat_template_kwargs").getBooleanValue("thinking")).isTrue();
    }

    @Test
    void streamingUpstreamErrorKeepsStatus() {
        when(upstreamClient.openStream(any()))
                .thenReturn(Mono.error(new UpstreamApiException(503, "{\"error\":\"overloaded\"}")));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("api_error")
                .jsonPath("$.error.code").isEqualTo(503);
    }

    @Test
    void mapsUpstreamErrorToEnvelope() {
        when(upstreamClient.complete(any()))
                .thenReturn(Mono.error(new UpstreamApiException(429, "{\"error\":\"rate limited\"}")));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("NIM API 错误: 429 - {\"error\":\"rate limited\"}")
                .jsonPath("$.error.type").isEqualTo("api_error")
                .jsonPath("$.error.code").isEqualTo(429);
    }

    @Test
    void unknownModelIsProbedBeforeForwarding() {
        when(upstreamClient.probe("meta/llama-3.3-70b-instruct")).thenReturn(Mono.just(ProbeResult.ofStatus(200)));
        when(upstreamClient.complete(any())).thenReturn(Mono.just(JSONObject.parseObject(UPSTREAM_RESPONSE)));

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"meta/llama-3.3-70b-instruct\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.model").isEqualTo("meta/llama-3.3-70b-instruct");

        ArgumentCaptor<JSONObject> payload = ArgumentCaptor.forClass(JSONObject.class);
        verify(upstreamClient).complete(payload.capture());
        assertThat(payload.getValue().getString("model")).isEqualTo("meta/llama-3.3-70b-instruct");
    }

    @Test
    void listsAliasesAsModels() {
        client.get().uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data.length()").isEqualTo(4)
                .jsonPath("$.data[0].id").isEqualTo("gpt-3.5-turbo")
                .jsonPath("$.data[0].owned_by").isEqualTo("nvidia-nim-proxy");
    }

    @Test
    void healthReportsFlags() {
        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.reasoning_display").isEqualTo(false)
                .jsonPath("$.thinking_mode").isEqualTo(true);
    }

    @Test
    void unknownRouteReturnsErrorEnvelope() {
        client.get().uri("/v1/unknown")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Endpoint /v1/unknown not found")
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.code").isEqualTo(404);
    }
}
