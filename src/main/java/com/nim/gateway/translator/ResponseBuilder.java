package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nim.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * NIM → OpenAI 非流式响应转换
 * <p>
 * 重新生成 id / created，model 回显客户端请求的模型名，usage 原样保留（缺失时补 0）
 */
@Component
public class ResponseBuilder {

    private static final Logger log = LoggerFactory.getLogger(ResponseBuilder.class);

    private final AppProperties properties;

    public ResponseBuilder(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * 构建 OpenAI Chat Completion 响应
     *
     * @param requestedModel 客户端请求的模型名
     * @param upstream       NIM 响应
     * @param thinking       解析出的后端模型是否为 thinking 模型
     */
    public JSONObject build(String requestedModel, JSONObject upstream, boolean thinking) {
        boolean showReasoning = properties.getReasoning().isShow();
        JSONArray upstreamChoices = upstream.getJSONArray("choices");
        logRawContent(upstreamChoices);

        JSONArray choices = new JSONArray();
        if (upstreamChoices != null) {
            for (int i = 0; i < upstreamChoices.size(); i++) {
                JSONObject choice = upstreamChoices.getJSONObject(i);
                if (choice != null) {
                    choices.add(translateChoice(choice, thinking, showReasoning));
                }
            }
        }

        JSONObject usage = upstream.getJSONObject("usage");
        if (usage == null) {
            usage = JSONObject.of( //
                    "prompt_tokens", 0, //
                    "completion_tokens", 0, //
                    "total_tokens", 0 //
            );
        }

        JSONObject result = new JSONObject();
        result.put("id", "chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24));
        result.put("object", "chat.completion");
        result.put("created", System.currentTimeMillis() / 1000);
        result.put("model", requestedModel);
        result.put("choices", choices);
        result.put("usage", usage);
        return result;
    }

    private JSONObject translateChoice(JSONObject choice, boolean thinking, boolean showReasoning) {
        JSONObject message = choice.getJSONObject("message");
        String role = message != null ? message.getString("role") : null;
        String content = message != null ? message.getString("content") : null;
        String reasoning = message != null ? ThinkingParser.reasoningOf(message) : null;
        if (content == null) {
            content = "";
        }
        if (reasoning == null) {
            reasoning = "";
        }

        // 非 thinking 模型把 <think> 块直接写进了正文
        ThinkingParser.ParseResult inline = !thinking && reasoning.isEmpty()
                ? ThinkingParser.extractInline(content) : null;
        if (inline != null) {
            content = showReasoning ? ThinkingParser.wrap(inline.thinking(), inline.content()) : inline.content();
        } else if (showReasoning && !reasoning.isEmpty()) {
            content = ThinkingParser.wrap(reasoning, content);
        }

        JSONObject translated = new JSONObject();
        translated.put("index", choice.get("index"));
        translated.put("message", JSONObject.of("role", role != null ? role : "assistant", "content", content));
        translated.put("finish_reason", choice.get("finish_reason"));
        return translated;
    }

    private void logRawContent(JSONArray choices) {
        if (!log.isDebugEnabled() || choices == null || choices.isEmpty()) {
            return;
        }
        JSONObject message = choices.getJSONObject(0) != null ? choices.getJSONObject(0).getJSONObject("message") : null;
        String raw = message != null ? message.getString("content") : null;
        log.debug("原始 content 含换行: {}", raw != null ? raw.contains("\n") : "null");
        log.debug("原始 content 样例: {}", raw != null ? raw.substring(0, Math.min(300, raw.length())) : "null");
        log.debug("reasoning_content 存在: {}", message != null && ThinkingParser.reasoningOf(message) != null);
    }
}
