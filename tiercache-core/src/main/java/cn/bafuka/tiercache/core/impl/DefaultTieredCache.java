package cn.bafuka.tiercache.core.impl;

import cn.bafuka.tiercache.codec.ValueCodec;
import cn.bafuka.tiercache.consistency.VersionRegistry;
import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.CacheMetricsSnapshot;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.dataplane.L1LocalTier;
import cn.bafuka.tiercache.dataplane.L2RemoteTier;
import cn.bafuka.tiercache.exception.CacheCodecException;
import cn.bafuka.tiercache.metrics.CacheMetricsCollector;
import cn.bafuka.tiercache.metrics.MetricsReporter;
import cn.bafuka.tiercache.support.CacheKeys;
import cn.bafuka.tiercache.transport.RemoteReply;
import com.alibaba.fastjson.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 两级缓存门面默认实现
 * 组合策略表、L1、L2、版本号登记表和指标收集器。
 * 远程失败统一在这里转换为未命中或空操作
 */
@Slf4j
public class DefaultTieredCache implements TieredCache {

    private final StrategyTable strategyTable;

    private final L1LocalTier l1LocalTier;

    private final L2RemoteTier l2RemoteTier;

    private final VersionRegistry versionRegistry;

    private final ValueCodec codec;

    private final CacheMetricsCollector metrics;

    /**
     * 指标定时输出，为 null 时不输出
     */
    private final MetricsReporter metricsReporter;

    public DefaultTieredCache(StrategyTable strategyTable,
                              L1LocalTier l1LocalTier,
                              L2RemoteTier l2RemoteTier,
                              VersionRegistry versionRegistry,
                              ValueCodec codec,
                              CacheMetricsCollector metrics,
                              MetricsReporter metricsReporter) {
        this.strategyTable = strategyTable;
        this.l1LocalTier = l1LocalTier;
        this.l2RemoteTier = l2RemoteTier;
        this.versionRegistry = versionRegistry;
        this.codec = codec;
        this.metrics = metrics;
        this.metricsReporter = metricsReporter;
    }

    @Override
    public <T> T get(CacheDomain domain, String key, Class<T> type) {
        return read(domain, key, Objects.requireNonNull(type, "type"));
    }

    @Override
    public <T> T get(CacheDomain domain, String key, TypeReference<T> type) {
        return read(domain, key, Objects.requireNonNull(type, "type").getType());
    }

    private <T> T read(CacheDomain domain, String key, Type type) {
        checkArguments(domain, key);
        ensureReporter();

        String fullKey = qualifiedKey(domain, key);

        // L1
        String l1Value = l1LocalTier.get(domain, fullKey);
        if (l1Value != null) {
            try {
                T value = codec.decode(l1Value, type);
                metrics.recordL1Hit(domain);
                return value;
            } catch (CacheCodecException e) {
                log.warn("L1 缓存内容损坏，已删除: domain={}, key={}", domain, fullKey, e);
                l1LocalTier.delete(domain, fullKey);
            }
        }
        metrics.recordL1Miss(domain);

        // L2
        RemoteReply reply = l2RemoteTier.get(domain, fullKey);
        recordRemoteFailure(domain, "GET", fullKey, reply);
        String l2Value = reply.asString();
        if (l2Value == null) {
            metrics.recordL2Miss(domain);
            return null;
        }

        T value;
        try {
            value = codec.decode(l2Value, type);
        } catch (CacheCodecException e) {
            // 损坏的 L2 条目不回填 L1，留给 L2 自然过期
            log.warn("L2 缓存内容损坏，按未命中处理: domain={}, key={}", domain, fullKey, e);
            metrics.recordL2Miss(domain);
            return null;
        }
        metrics.recordL2Hit(domain);
        l1LocalTier.set(domain, fullKey, l2Value);
        return value;
    }

    @Override
    public void set(CacheDomain domain, String key, Object value) {
        checkArguments(domain, key);
        ensureReporter();
        metrics.recordSet(domain);

        String fullKey = qualifiedKey(domain, key);
        String encoded;
        try {
            encoded = codec.encode(value);
        } catch (CacheCodecException e) {
            log.warn("缓存值无法序列化，跳过写入: domain={}, key={}", domain, fullKey, e);
            return;
        }

        l1LocalTier.set(domain, fullKey, encoded);
        RemoteReply reply = l2RemoteTier.set(domain, fullKey, encoded);
        recordRemoteFailure(domain, "SET", fullKey, reply);
    }

    @Override
    public void invalidate(CacheDomain domain, String key) {
        checkArguments(domain, key);
        ensureReporter();
        metrics.recordInvalidation(domain);

        String fullKey = qualifiedKey(domain, key);
        l1LocalTier.delete(domain, fullKey);
        RemoteReply reply = l2RemoteTier.delete(fullKey);
        recordRemoteFailure(domain, "DEL", fullKey, reply);
        log.debug("缓存失效: domain={}, key={}", domain, fullKey);
    }

    @Override
    public void invalidateByDomain(CacheDomain domain) {
        strategyTable.strategyOf(domain);
        ensureReporter();
        metrics.recordInvalidation(domain);

        l1LocalTier.clear(domain);
        long generation = versionRegistry.bump(domain);
        log.info("缓存域已整体失效: domain={}, generation={}", domain, generation);
    }

    @Override
    public CacheMetricsSnapshot getMetrics(CacheDomain domain) {
        strategyTable.strategyOf(domain);
        return metrics.snapshot(domain);
    }

    /**
     * 停止指标定时输出
     */
    public void shutdown() {
        if (metricsReporter != null) {
            metricsReporter.shutdown();
        }
    }

    private String qualifiedKey(CacheDomain domain, String key) {
        long generation = versionRegistry.currentGeneration(domain);
        return CacheKeys.dataKey(domain, generation, key);
    }

    private void checkArguments(CacheDomain domain, String key) {
        strategyTable.strategyOf(domain);
        Objects.requireNonNull(key, "key");
    }

    private void ensureReporter() {
        if (metricsReporter != null) {
            metricsReporter.ensureStarted();
        }
    }

    /**
     * 远程已配置但调用失败时计数；未配置（DISABLED）属于预期降级，不计数
     */
    private void recordRemoteFailure(CacheDomain domain, String command, String fullKey, RemoteReply reply) {
        if (reply.isFailed()) {
            metrics.recordL2Error(domain);
            log.debug("L2 {} 失败，降级处理: domain={}, key={}, reason={}",
                    command, domain, fullKey, reply.getError().getReason());
        }
    }
}
