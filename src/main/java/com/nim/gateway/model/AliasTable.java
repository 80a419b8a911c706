package com.nim.gateway.model;

import com.nim.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 静态别名表
 * <p>
 * 启动时从 nim.model-mapping 加载一次，此后只读
 */
@Component
public class AliasTable {

    private final Map<String, ModelAlias> aliases;

    public AliasTable(AppProperties properties) {
        Map<String, ModelAlias> loaded = new LinkedHashMap<>();
        for (AppProperties.AliasConfig entry : properties.getModelMapping()) {
            if (entry.getName() == null || entry.getTarget() == null) {
                throw new IllegalStateException("nim.model-mapping 配置不完整: name=" + entry.getName() + ", target=" + entry.getTarget());
            }
            loaded.put(entry.getName(), new ModelAlias(entry.getName(), entry.getTarget()));
        }
        this.aliases = Collections.unmodifiableMap(loaded);
    }

    /**
     * 查找别名对应的后端模型名
     *
     * @return 后端模型名，未配置时返回 null
     */
    public String lookup(String publicName) {
        if (publicName == null) {
            return null;
        }
        ModelAlias alias = aliases.get(publicName);
        return alias != null ? alias.backendName() : null;
    }

    public List<ModelAlias> all() {
        return new ArrayList<>(aliases.values());
    }

    public int size() {
        return aliases.size();
    }
}
