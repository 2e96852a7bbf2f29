package cn.bafuka.tiercache.dataplane.impl;

import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.dataplane.L1LocalTier;
import cn.bafuka.tiercache.model.CacheStrategy;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * L1 本地缓存实现
 * 每个域一个按插入顺序排列的 Map，满了淘汰最早插入的条目（FIFO，不是 LRU），
 * 过期在读取时惰性处理，没有后台清理
 */
@Slf4j
public class FifoL1LocalTier implements L1LocalTier {

    /**
     * 多域缓存容器
     * Key: 缓存域
     * Value: 该域的条目存储
     */
    private final Map<CacheDomain, DomainStore> stores = new ConcurrentHashMap<>();

    private final StrategyTable strategyTable;

    private final Clock clock;

    public FifoL1LocalTier(StrategyTable strategyTable) {
        this(strategyTable, Clock.systemUTC());
    }

    public FifoL1LocalTier(StrategyTable strategyTable, Clock clock) {
        this.strategyTable = strategyTable;
        this.clock = clock;
    }

    @Override
    public String get(CacheDomain domain, String qualifiedKey) {
        strategyTable.strategyOf(domain);
        DomainStore store = stores.get(domain);
        if (store == null) {
            return null;
        }
        return store.get(qualifiedKey, clock.millis());
    }

    @Override
    public void set(CacheDomain domain, String qualifiedKey, String encodedValue) {
        CacheStrategy strategy = strategyTable.strategyOf(domain);
        if (!strategy.isL1Enabled() || encodedValue == null) {
            return;
        }

        if (strategy.hasL1ValueSizeLimit()
                && encodedValue.getBytes(StandardCharsets.UTF_8).length > strategy.getL1MaxValueSize()) {
            log.debug("值超过 L1 大小上限，仅写入 L2: domain={}, key={}, limit={}",
                    domain, qualifiedKey, strategy.getL1MaxValueSize());
            return;
        }

        long expiresAt = clock.millis() + strategy.getL1TtlMs();
        stores.computeIfAbsent(domain, k -> new DomainStore())
                .put(qualifiedKey, encodedValue, expiresAt, strategy.getL1MaxEntries());
    }

    @Override
    public void delete(CacheDomain domain, String qualifiedKey) {
        strategyTable.strategyOf(domain);
        DomainStore store = stores.get(domain);
        if (store != null) {
            store.remove(qualifiedKey);
        }
    }

    @Override
    public void clear(CacheDomain domain) {
        strategyTable.strategyOf(domain);
        DomainStore store = stores.get(domain);
        if (store != null) {
            int dropped = store.clear();
            log.info("L1 缓存全部失效: domain={}, dropped={}", domain, dropped);
        }
    }

    @Override
    public int size(CacheDomain domain) {
        DomainStore store = stores.get(domain);
        return store == null ? 0 : store.size();
    }

    /**
     * 单个域的条目存储
     * LinkedHashMap 保持插入顺序，覆盖写不改变条目位置
     */
    private static final class DomainStore {

        private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

        synchronized String get(String key, long now) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.expiresAt <= now) {
                entries.remove(key);
                return null;
            }
            return entry.value;
        }

        synchronized void put(String key, String value, long expiresAt, int maxEntries) {
            if (entries.size() >= maxEntries && !entries.containsKey(key)) {
                Iterator<String> oldest = entries.keySet().iterator();
                if (oldest.hasNext()) {
                    String evicted = oldest.next();
                    oldest.remove();
                    log.debug("L1 缓存已满，淘汰最早条目: key={}", evicted);
                }
            }
            entries.put(key, new Entry(value, expiresAt));
        }

        synchronized void remove(String key) {
            entries.remove(key);
        }

        synchronized int clear() {
            int size = entries.size();
            entries.clear();
            return size;
        }

        synchronized int size() {
            return entries.size();
        }
    }

    private static final class Entry {

        private final String value;
        private final long expiresAt;

        Entry(String value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
