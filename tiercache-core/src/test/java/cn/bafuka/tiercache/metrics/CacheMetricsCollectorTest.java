package cn.bafuka.tiercache.metrics;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.CacheMetricsSnapshot;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * CacheMetricsCollector 单元测试
 */
public class CacheMetricsCollectorTest {

    @Test
    public void testCounters() {
        CacheMetricsCollector collector = new CacheMetricsCollector();
        collector.recordL1Hit(CacheDomain.AUTHOR);
        collector.recordL1Hit(CacheDomain.AUTHOR);
        collector.recordL1Miss(CacheDomain.AUTHOR);
        collector.recordL2Hit(CacheDomain.AUTHOR);
        collector.recordL2Miss(CacheDomain.AUTHOR);
        collector.recordSet(CacheDomain.AUTHOR);
        collector.recordInvalidation(CacheDomain.AUTHOR);
        collector.recordL2Error(CacheDomain.AUTHOR);

        CacheMetricsSnapshot snapshot = collector.snapshot(CacheDomain.AUTHOR);
        assertEquals("author", snapshot.getDomain());
        assertEquals(2, snapshot.getL1Hits());
        assertEquals(1, snapshot.getL1Misses());
        assertEquals(1, snapshot.getL2Hits());
        assertEquals(1, snapshot.getL2Misses());
        assertEquals(1, snapshot.getSets());
        assertEquals(1, snapshot.getInvalidations());
        assertEquals(1, snapshot.getL2Errors());
        assertEquals(2.0 / 3, snapshot.l1HitRate(), 1e-9);
        assertEquals(0.5, snapshot.l2HitRate(), 1e-9);
    }

    /**
     * 快照是副本，之后的计数不影响已取出的快照
     */
    @Test
    public void testSnapshotIsCopy() {
        CacheMetricsCollector collector = new CacheMetricsCollector();
        collector.recordSet(CacheDomain.SIDEBAR);

        CacheMetricsSnapshot snapshot = collector.snapshot(CacheDomain.SIDEBAR);
        collector.recordSet(CacheDomain.SIDEBAR);

        assertEquals(1, snapshot.getSets());
        assertEquals(2, collector.snapshot(CacheDomain.SIDEBAR).getSets());
    }

    @Test
    public void testUntouchedDomainIsZero() {
        CacheMetricsSnapshot snapshot = new CacheMetricsCollector().snapshot(CacheDomain.MARKDOWN);
        assertFalse(snapshot.hasActivity());
        assertEquals(0.0, snapshot.l1HitRate(), 0.0);
    }

    @Test
    public void testActiveSnapshots() {
        CacheMetricsCollector collector = new CacheMetricsCollector();
        collector.snapshot(CacheDomain.AUTHOR);
        collector.recordL1Miss(CacheDomain.MARKDOWN);
        collector.recordInvalidation(CacheDomain.ARTICLE_LIST);

        List<CacheMetricsSnapshot> active = collector.activeSnapshots();
        assertEquals(2, active.size());
        assertEquals("article-list", active.get(0).getDomain());
        assertEquals("markdown", active.get(1).getDomain());
    }
}
