package com.nim.gateway.translator;

import com.alibaba.fastjson2.JSONObject;

/**
 * 请求转换接口
 * <p>
 * 将客户端 OpenAI 请求转换为 NIM 上游请求
 */
public interface RequestTranslator {

    /**
     * 转换请求
     *
     * @param request      原始请求体 JSON
     * @param backendModel 解析后的 NIM 模型名
     * @param isThinking   是否下发 thinking 指令
     * @return 上游请求体
     */
    JSONObject translate(JSONObject request, String backendModel, boolean isThinking);
}
