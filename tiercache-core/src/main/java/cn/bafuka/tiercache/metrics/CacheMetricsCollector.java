package cn.bafuka.tiercache.metrics;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.CacheMetricsSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 缓存指标收集器
 * 每个域一组计数器，首次访问时创建，进程内只增不减
 */
public class CacheMetricsCollector {

    private final Map<CacheDomain, DomainCounters> counters = new ConcurrentHashMap<>();

    public void recordL1Hit(CacheDomain domain) {
        counters(domain).l1Hits.increment();
    }

    public void recordL1Miss(CacheDomain domain) {
        counters(domain).l1Misses.increment();
    }

    public void recordL2Hit(CacheDomain domain) {
        counters(domain).l2Hits.increment();
    }

    public void recordL2Miss(CacheDomain domain) {
        counters(domain).l2Misses.increment();
    }

    public void recordSet(CacheDomain domain) {
        counters(domain).sets.increment();
    }

    public void recordInvalidation(CacheDomain domain) {
        counters(domain).invalidations.increment();
    }

    public void recordL2Error(CacheDomain domain) {
        counters(domain).l2Errors.increment();
    }

    /**
     * 获取域指标快照
     *
     * @param domain 缓存域
     * @return 快照，未发生过访问的域返回全零
     */
    public CacheMetricsSnapshot snapshot(CacheDomain domain) {
        DomainCounters c = counters(domain);
        return CacheMetricsSnapshot.builder()
                .domain(domain.getLabel())
                .l1Hits(c.l1Hits.sum())
                .l1Misses(c.l1Misses.sum())
                .l2Hits(c.l2Hits.sum())
                .l2Misses(c.l2Misses.sum())
                .sets(c.sets.sum())
                .invalidations(c.invalidations.sum())
                .l2Errors(c.l2Errors.sum())
                .build();
    }

    /**
     * 所有有访问记录的域的快照，按域声明顺序排列
     */
    public List<CacheMetricsSnapshot> activeSnapshots() {
        List<CacheMetricsSnapshot> result = new ArrayList<>();
        for (CacheDomain domain : CacheDomain.values()) {
            if (!counters.containsKey(domain)) {
                continue;
            }
            CacheMetricsSnapshot snapshot = snapshot(domain);
            if (snapshot.hasActivity()) {
                result.add(snapshot);
            }
        }
        return result;
    }

    private DomainCounters counters(CacheDomain domain) {
        Objects.requireNonNull(domain, "domain");
        return counters.computeIfAbsent(domain, d -> new DomainCounters());
    }

    private static final class DomainCounters {
        private final LongAdder l1Hits = new LongAdder();
        private final LongAdder l1Misses = new LongAdder();
        private final LongAdder l2Hits = new LongAdder();
        private final LongAdder l2Misses = new LongAdder();
        private final LongAdder sets = new LongAdder();
        private final LongAdder invalidations = new LongAdder();
        private final LongAdder l2Errors = new LongAdder();
    }
}
