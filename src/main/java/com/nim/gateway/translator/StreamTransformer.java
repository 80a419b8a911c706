package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.nim.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * SSE 流式响应转换器
 * <p>
 * 逐片接收上游字节流，按行重组 SSE 事件，把 reasoning_content 合并进 content 后重新输出。
 * 分片边界与行边界无关：不完整的行留在缓冲区等待下一片，按字节切分，多字节 UTF-8 字符不会被截断。
 * <p>
 * 每个流式请求独占一个实例，非线程安全。
 */
public class StreamTransformer {

    private static final Logger log = LoggerFactory.getLogger(StreamTransformer.class);

    public static final String DONE_EVENT = "data: [DONE]\n\n";

    private static final String DATA_PREFIX = "data:";
    private static final byte LINE_FEED = '\n';

    private final boolean showReasoning;

    // 尚未遇到换行的残余字节
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    // 输出中已打开 <think> 且尚未关闭
    private boolean reasoningOpen = false;

    public StreamTransformer(boolean showReasoning) {
        this.showReasoning = showReasoning;
    }

    /**
     * 输入一个上游分片
     *
     * @param chunk 原始字节
     * @return 需要写给客户端的完整事件（每个以空行结尾），可能为空
     */
    public List<String> next(byte[] chunk) {
        List<String> events = new ArrayList<>();
        if (chunk == null || chunk.length == 0) {
            return events;
        }

        int lineStart = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] == LINE_FEED) {
                pending.write(chunk, lineStart, i - lineStart);
                String line = pending.toString(StandardCharsets.UTF_8);
                pending.reset();
                handleLine(line, events);
                lineStart = i + 1;
            }
        }
        pending.write(chunk, lineStart, chunk.length - lineStart);
        return events;
    }

    /**
     * 上游流正常结束
     * <p>
     * 处理末尾没有换行的残余行；若 think 块仍未关闭，补发关闭标记
     */
    public List<String> finish() {
        List<String> events = new ArrayList<>();
        if (pending.size() > 0) {
            String tail = pending.toString(StandardCharsets.UTF_8);
            pending.reset();
            handleLine(tail, events);
        }
        closeReasoning(events);
        return events;
    }

    public boolean isReasoningOpen() {
        return reasoningOpen;
    }

    private void handleLine(String rawLine, List<String> events) {
        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (!line.startsWith(DATA_PREFIX)) {
            return;
        }

        String payload = line.substring(DATA_PREFIX.length()).strip();
        if ("[DONE]".equals(payload)) {
            closeReasoning(events);
            events.add(DONE_EVENT);
            return;
        }

        JSONObject data;
        try {
            data = JSONObject.parseObject(payload);
        } catch (Exception e) {
            dropLine(payload, e.getMessage());
            return;
        }
        if (data == null) {
            dropLine(payload, "空 payload");
            return;
        }

        mergeReasoning(data, events);
        events.add(toEvent(data));
    }

    private void mergeReasoning(JSONObject data, List<String> events) {
        // 结构不符的 chunk 原样转发
        if (!(data.get("choices") instanceof JSONArray choices) || choices.isEmpty()) {
            return;
        }
        if (!(choices.get(0) instanceof JSONObject choice)) {
            return;
        }
        if (!(choice.get("delta") instanceof JSONObject delta)) {
            return;
        }

        String reasoning = ThinkingParser.reasoningOf(delta);
        String content = delta.getString("content");

        if (showReasoning) {
            // 关闭标记单独成事件，不与正文拼在同一个 delta 里
            if (reasoningOpen && isEmpty(reasoning) && !isEmpty(content)) {
                events.add(toEvent(closingChunk(data)));
                reasoningOpen = false;
            }

            StringBuilder combined = new StringBuilder();
            if (!isEmpty(reasoning)) {
                if (!reasoningOpen) {
                    combined.append(ThinkingParser.OPEN_MARKER);
                    reasoningOpen = true;
                }
                combined.append(reasoning);
            }
            if (!isEmpty(content)) {
                combined.append(content);
            }
            delta.put("content", combined.toString());
        } else {
            delta.put("content", content != null ? content : "");
        }

        ThinkingParser.stripReasoning(delta);
    }

    private void closeReasoning(List<String> events) {
        if (!reasoningOpen) {
            return;
        }
        JSONObject chunk = JSONObject.of(
                "choices", JSONArray.of(JSONObject.of( //
                        "index", 0, //
                        "delta", JSONObject.of("content", ThinkingParser.CLOSE_MARKER) //
                )) //
        );
        events.add(toEvent(chunk));
        reasoningOpen = false;
    }

    private JSONObject closingChunk(JSONObject source) {
        JSONObject choice = new JSONObject();
        choice.put("index", 0);
        choice.put("delta", JSONObject.of("content", ThinkingParser.CLOSE_MARKER));
        choice.put("finish_reason", null);

        JSONObject chunk = new JSONObject();
        if (source.get("id") != null) {
            chunk.put("id", source.get("id"));
        }
        if (source.get("object") != null) {
            chunk.put("object", source.get("object"));
        }
        chunk.put("choices", JSONArray.of(choice));
        return chunk;
    }

    private void dropLine(String payload, String reason) {
        log.warn("SSE 解析失败，丢弃该行: {} | payload={}", reason, abbreviate(payload));
        Metrics.instance().increment("sse_lines_dropped");
    }

    private static String toEvent(JSONObject data) {
        return "data: " + data.toJSONString(JSONWriter.Feature.WriteNulls) + "\n\n";
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    private static String abbreviate(String s) {
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
