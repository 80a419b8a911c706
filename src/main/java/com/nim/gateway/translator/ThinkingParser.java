package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONObject;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thinking 内容处理工具
 * <p>
 * NIM 的 reasoning 通道有两种形态：delta/message 上的 reasoning_content 字段，
 * 或非 thinking 模型直接把 &lt;think&gt;...&lt;/think&gt; 写进正文。
 * 这里集中定义输出标记，并负责两种形态的识别与包裹。
 */
public final class ThinkingParser {

    public static final String OPEN_MARKER = "<think>\n";
    public static final String CLOSE_MARKER = "</think>\n\n";

    private static final String OPEN_TAG = "<think>";
    private static final Pattern INLINE_THINKING = Pattern.compile("^<think>([\\s\\S]*?)</think>\\s*([\\s\\S]*)$");

    private ThinkingParser() {
    }

    /**
     * 读取 reasoning 字段，优先 reasoning_content，其次 reasoning
     *
     * @return reasoning 文本，不存在时为 null
     */
    public static String reasoningOf(JSONObject node) {
        String reasoning = node.getString("reasoning_content");
        if (reasoning == null) {
            reasoning = node.getString("reasoning");
        }
        return reasoning;
    }

    /**
     * 移除 reasoning 字段
     */
    public static void stripReasoning(JSONObject node) {
        node.remove("reasoning_content");
        node.remove("reasoning");
    }

    /**
     * 非流式输出的完整包裹：&lt;think&gt;\n推理\n&lt;/think&gt;\n\n正文
     */
    public static String wrap(String reasoning, String content) {
        return OPEN_MARKER + reasoning + "\n" + CLOSE_MARKER + content;
    }

    /**
     * 识别正文开头内嵌的 think 块
     *
     * @param content 原始正文
     * @return 拆分结果（两部分均已 trim），不匹配时返回 null
     */
    public static ParseResult extractInline(String content) {
        if (content == null || !content.startsWith(OPEN_TAG)) {
            return null;
        }
        Matcher matcher = INLINE_THINKING.matcher(content);
        if (!matcher.matches()) {
            return null;
        }
        return new ParseResult(matcher.group(1).trim(), matcher.group(2).trim());
    }

    /**
     * 解析结果
     */
    public record ParseResult(String thinking, String content) {}
}
