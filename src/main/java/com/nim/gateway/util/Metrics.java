package com.nim.gateway.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus 风格指标收集器
 * <p>
 * 请求计数、模型解析来源、探测次数、延迟直方图
 */
public class Metrics {

    private static final Metrics INSTANCE = new Metrics();
    private static final String PREFIX = "nim_";

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    // 延迟直方图桶（毫秒）
    private final long[] bucketBounds = {100, 500, 1000, 5000, 10000, 30000, 60000, 300000};
    private final ConcurrentHashMap<String, long[]> histograms = new ConcurrentHashMap<>();

    public static Metrics instance() {
        return INSTANCE;
    }

    public void increment(String name) {
        counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
    }

    public long get(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    /**
     * 记录延迟到直方图
     */
    public void recordLatency(String name, long latencyMs) {
        long[] buckets = histograms.computeIfAbsent(name, k -> new long[bucketBounds.length + 1]);
        synchronized (buckets) {
            for (int i = 0; i < bucketBounds.length; i++) {
                if (latencyMs <= bucketBounds[i]) {
                    buckets[i]++;
                    return;
                }
            }
            buckets[bucketBounds.length]++;
        }
    }

    /**
     * 记录一次 chat/completions 请求
     */
    public void recordRequest(boolean stream, boolean success, long latencyMs) {
        increment("requests_total");
        increment(stream ? "requests_stream" : "requests_non_stream");
        increment(success ? "requests_success" : "requests_error");
        recordLatency("request_latency_ms", latencyMs);
    }

    /**
     * 记录一次模型解析，按来源（alias/cache/probe/fallback）计数
     */
    public void recordResolution(String source) {
        increment("resolutions_" + source);
    }

    /**
     * 输出 Prometheus 文本格式
     */
    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        Map<String, AtomicLong> sorted = new TreeMap<>(counters);
        sorted.forEach((name, value) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" counter\n");
            sb.append(PREFIX).append(name).append(" ").append(value.get()).append("\n");
        });

        histograms.forEach((name, buckets) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" histogram\n");
            long cumulative = 0;
            synchronized (buckets) {
                for (int i = 0; i < bucketBounds.length; i++) {
                    cumulative += buckets[i];
                    sb.append(PREFIX).append(name).append("_bucket{le=\"")
                            .append(bucketBounds[i]).append("\"} ").append(cumulative).append("\n");
                }
                cumulative += buckets[bucketBounds.length];
                sb.append(PREFIX).append(name).append("_bucket{le=\"+Inf\"} ").append(cumulative).append("\n");
                sb.append(PREFIX).append(name).append("_count ").append(cumulative).append("\n");
            }
        });

        return sb.toString();
    }
}
