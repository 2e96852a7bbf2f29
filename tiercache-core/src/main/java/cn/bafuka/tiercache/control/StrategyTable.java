package cn.bafuka.tiercache.control;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.exception.UnknownCacheDomainException;
import cn.bafuka.tiercache.model.CacheStrategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 策略表
 * 缓存域到缓存策略的固定映射，启动时构建，之后只读
 */
public final class StrategyTable {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;

    private final Map<CacheDomain, CacheStrategy> strategies;

    private StrategyTable(Map<CacheDomain, CacheStrategy> strategies) {
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(strategies));
    }

    /**
     * 默认策略表
     *
     * @return 覆盖全部缓存域的策略表
     */
    public static StrategyTable defaults() {
        return builder().build();
    }

    /**
     * 以默认策略为起点的构建器
     */
    public static Builder builder() {
        return new Builder(defaultStrategies());
    }

    /**
     * 空白构建器，只包含显式注册的域
     */
    public static Builder emptyBuilder() {
        return new Builder(new EnumMap<>(CacheDomain.class));
    }

    /**
     * 查询域策略
     *
     * @param domain 缓存域
     * @return 缓存策略
     * @throws UnknownCacheDomainException 域为空或未注册
     */
    public CacheStrategy strategyOf(CacheDomain domain) {
        CacheStrategy strategy = domain == null ? null : strategies.get(domain);
        if (strategy == null) {
            throw new UnknownCacheDomainException(domain == null ? null : domain.getLabel());
        }
        return strategy;
    }

    public boolean contains(CacheDomain domain) {
        return domain != null && strategies.containsKey(domain);
    }

    public Map<CacheDomain, CacheStrategy> asMap() {
        return strategies;
    }

    private static Map<CacheDomain, CacheStrategy> defaultStrategies() {
        Map<CacheDomain, CacheStrategy> map = new EnumMap<>(CacheDomain.class);
        map.put(CacheDomain.AUTHOR, strategy(5 * MINUTE, 10 * MINUTE, 500, 0));
        map.put(CacheDomain.SITE_SETTINGS, strategy(MINUTE, 5 * MINUTE, 5, 0));
        map.put(CacheDomain.SIDEBAR, strategy(10 * MINUTE, 30 * MINUTE, 10, 0));
        map.put(CacheDomain.ARTICLE_LIST, strategy(30 * SECOND, 2 * MINUTE, 100, 0));
        map.put(CacheDomain.ARTICLE_DETAIL, strategy(2 * MINUTE, 10 * MINUTE, 200, 0));
        map.put(CacheDomain.DIARY_LIST, strategy(30 * SECOND, 2 * MINUTE, 50, 0));
        map.put(CacheDomain.DIARY_DETAIL, strategy(2 * MINUTE, 10 * MINUTE, 100, 0));
        map.put(CacheDomain.ALBUM_LIST, strategy(30 * SECOND, 2 * MINUTE, 50, 0));
        map.put(CacheDomain.ALBUM_DETAIL, strategy(2 * MINUTE, 10 * MINUTE, 100, 0));
        map.put(CacheDomain.USER_HOME, strategy(2 * MINUTE, 5 * MINUTE, 50, 0));
        // 渲染后的 HTML 可能很大，超过 50KB 的只进 L2
        map.put(CacheDomain.MARKDOWN, strategy(5 * MINUTE, 60 * MINUTE, 200, 50 * 1024));
        return map;
    }

    private static CacheStrategy strategy(long l1TtlMs, long l2TtlMs, int l1MaxEntries, int l1MaxValueSize) {
        return CacheStrategy.builder()
                .l1TtlMs(l1TtlMs)
                .l2TtlMs(l2TtlMs)
                .l1MaxEntries(l1MaxEntries)
                .l1MaxValueSize(l1MaxValueSize)
                .build();
    }

    /**
     * 策略表构建器
     */
    public static final class Builder {

        private final Map<CacheDomain, CacheStrategy> strategies;

        private Builder(Map<CacheDomain, CacheStrategy> strategies) {
            this.strategies = strategies;
        }

        public Builder strategy(CacheDomain domain, CacheStrategy strategy) {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(strategy, "strategy");
            if (strategy.getL1TtlMs() < 0 || strategy.getL2TtlMs() < 0
                    || strategy.getL1MaxEntries() < 0 || strategy.getL1MaxValueSize() < 0) {
                throw new IllegalArgumentException("缓存策略参数不能为负数: domain=" + domain + ", strategy=" + strategy);
            }
            strategies.put(domain, strategy);
            return this;
        }

        /**
         * 当前已登记的策略（用于在默认值基础上局部覆盖）
         */
        public CacheStrategy current(CacheDomain domain) {
            return strategies.get(domain);
        }

        public StrategyTable build() {
            return new StrategyTable(strategies);
        }
    }
}
