package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OpenAI → NIM 请求转换
 * <p>
 * messages 原样透传；temperature / max_tokens / stream 缺省时补默认值；
 * thinking 模型追加 chat_template_kwargs，其余模型不带该字段
 */
@Component
public class OpenAiTranslator implements RequestTranslator {

    // 存在时原样透传的采样参数
    private static final List<String> PASSTHROUGH_FIELDS = List.of(
            "top_p", "stop", "presence_penalty", "frequency_penalty", "seed");

    private final AppProperties properties;

    public OpenAiTranslator(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public JSONObject translate(JSONObject request, String backendModel, boolean isThinking) {
        AppProperties.DefaultsConfig defaults = properties.getDefaults();

        JSONObject payload = new JSONObject();
        payload.put("model", backendModel);
        payload.put("messages", request.getJSONArray("messages"));
        payload.put("temperature", request.get("temperature") != null
                ? request.get("temperature") : defaults.getTemperature());
        payload.put("max_tokens", request.get("max_tokens") != null
                ? request.get("max_tokens") : defaults.getMaxTokens());
        payload.put("stream", request.getBooleanValue("stream", false));

        for (String field : PASSTHROUGH_FIELDS) {
            Object value = request.get(field);
            if (value != null) {
                payload.put(field, value);
            }
        }

        if (isThinking) {
            payload.put("chat_template_kwargs", JSONObject.of("thinking", true));
        }
        return payload;
    }
}
