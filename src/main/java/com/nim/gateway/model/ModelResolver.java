package com.nim.gateway.model;

import com.nim.gateway.config.AppProperties;
import com.nim.gateway.proxy.UpstreamClient;
import com.nim.gateway.util.Metrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模型解析器
 * <p>
 * 将外部模型名（如 gpt-4o, claude-3-opus）解析为 NIM 后端模型名，顺序：
 * <ol>
 *     <li>别名表命中，直接返回，不访问网络</li>
 *     <li>解析缓存命中（含"探测失败"的空值）</li>
 *     <li>向上游发送探测请求，2xx 视为该名字本身就是 NIM 模型，结果先写缓存再使用</li>
 *     <li>仍未解析时按名字关键字兜底到 large / mid / small 三档模型</li>
 * </ol>
 * 解析永不失败。探测失败会在进程生命周期内一直缓存，上游后续上线该模型也不会重新探测。
 */
@Component
public class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final AliasTable aliasTable;
    private final UpstreamClient upstreamClient;
    private final AppProperties properties;
    private final Set<String> thinkingCapableModels;

    // 解析缓存：Optional.empty() 表示探测失败，走兜底
    private final Map<String, Optional<String>> resolutionCache = new ConcurrentHashMap<>();

    public ModelResolver(AliasTable aliasTable, UpstreamClient upstreamClient, AppProperties properties) {
        this.aliasTable = aliasTable;
        this.upstreamClient = upstreamClient;
        this.properties = properties;
        this.thinkingCapableModels = Set.copyOf(properties.getThinking().getCapableModels());
    }

    @PostConstruct
    public void init() {
        log.info("模型解析器初始化完成: {} 条别名, {} 个 thinking 模型, thinking 模式: {}",
                aliasTable.size(), thinkingCapableModels.size(), properties.getThinking().isEnabled());
    }

    /**
     * 解析外部模型名 → NIM 模型名
     *
     * @param requestedModel 客户端传入的模型名
     * @return 解析结果，永不以错误结束
     */
    public Mono<ResolveResult> resolve(String requestedModel) {
        String aliased = aliasTable.lookup(requestedModel);
        if (aliased != null) {
            return Mono.just(complete(requestedModel, aliased, Source.ALIAS));
        }

        if (requestedModel == null || requestedModel.isEmpty()) {
            return Mono.just(complete(requestedModel, fallbackFor(""), Source.FALLBACK));
        }

        Optional<String> cached = resolutionCache.get(requestedModel);
        if (cached != null) {
            return Mono.just(fromVerification(requestedModel, cached, Source.CACHE));
        }

        // 并发的首次探测各自写缓存，结果一致，后写覆盖先写
        return upstreamClient.probe(requestedModel)
                .map(probe -> {
                    Optional<String> verified = probe.available() ? Optional.of(requestedModel) : Optional.empty();
                    resolutionCache.put(requestedModel, verified);
                    return fromVerification(requestedModel, verified, Source.PROBE);
                });
    }

    /**
     * 后端模型是否下发 thinking 指令
     */
    public boolean isThinkingEligible(String backendModel) {
        return properties.getThinking().isEnabled() && thinkingCapableModels.contains(backendModel);
    }

    /**
     * 关键字兜底，按优先级首个命中生效
     */
    public String fallbackFor(String requestedModel) {
        String lower = requestedModel.toLowerCase(Locale.ROOT);
        AppProperties.FallbackConfig fallback = properties.getFallback();
        if (lower.contains("gpt-4") || lower.contains("claude-opus") || lower.contains("405b")) {
            return fallback.getLarge();
        }
        if (lower.contains("claude") || lower.contains("gemini") || lower.contains("70b")) {
            return fallback.getMid();
        }
        return fallback.getSmall();
    }

    /**
     * 别名列表（用于 /v1/models 端点）
     */
    public List<ModelAlias> listAliases() {
        return aliasTable.all();
    }

    private ResolveResult fromVerification(String requestedModel, Optional<String> verified, Source source) {
        return verified
                .map(backend -> complete(requestedModel, backend, source))
                .orElseGet(() -> complete(requestedModel, fallbackFor(requestedModel), Source.FALLBACK));
    }

    private ResolveResult complete(String requestedModel, String backendModel, Source source) {
        boolean thinking = isThinkingEligible(backendModel);
        log.info("模型解析: {} -> {} | thinking: {} | source: {}", requestedModel, backendModel, thinking, source.label());
        Metrics.instance().recordResolution(source.label());
        return new ResolveResult(requestedModel, backendModel, thinking, source);
    }

    // ==================== 数据类 ====================

    public enum Source {
        ALIAS, CACHE, PROBE, FALLBACK;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record ResolveResult(String requestedModel, String backendModel, boolean thinking, Source source) {}
}
