package cn.bafuka.tiercache.dataplane.impl;

import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.exception.UnknownCacheDomainException;
import cn.bafuka.tiercache.model.CacheStrategy;
import cn.bafuka.tiercache.support.MutableClock;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * FifoL1LocalTier 单元测试
 */
public class FifoL1LocalTierTest {

    private static final long TTL_MS = 1000;

    private MutableClock clock;

    private FifoL1LocalTier l1;

    @Before
    public void setUp() {
        clock = new MutableClock();
        StrategyTable table = StrategyTable.builder()
                .strategy(CacheDomain.AUTHOR, CacheStrategy.builder()
                        .l1TtlMs(TTL_MS).l2TtlMs(10_000).l1MaxEntries(3).build())
                .strategy(CacheDomain.SIDEBAR, CacheStrategy.builder()
                        .l1TtlMs(TTL_MS).l2TtlMs(10_000).l1MaxEntries(3).build())
                .strategy(CacheDomain.MARKDOWN, CacheStrategy.builder()
                        .l1TtlMs(TTL_MS).l2TtlMs(10_000).l1MaxEntries(3).l1MaxValueSize(10).build())
                .strategy(CacheDomain.USER_HOME, CacheStrategy.builder()
                        .l1TtlMs(0).l2TtlMs(10_000).l1MaxEntries(3).build())
                .build();
        l1 = new FifoL1LocalTier(table, clock);
    }

    @Test
    public void testGetAndSet() {
        l1.set(CacheDomain.AUTHOR, "k1", "\"v1\"");
        assertEquals("\"v1\"", l1.get(CacheDomain.AUTHOR, "k1"));
    }

    @Test
    public void testGetMiss() {
        assertNull(l1.get(CacheDomain.AUTHOR, "nonexistent"));
    }

    /**
     * TTL 内可读，超过 TTL 后未命中并被惰性删除
     */
    @Test
    public void testExpiration() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");

        clock.advanceMillis(TTL_MS - 1);
        assertEquals("v1", l1.get(CacheDomain.AUTHOR, "k1"));

        clock.advanceMillis(2);
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
        assertEquals(0, l1.size(CacheDomain.AUTHOR));
    }

    /**
     * expiresAt <= now 即视为过期
     */
    @Test
    public void testExpiresExactlyAtTtl() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        clock.advanceMillis(TTL_MS);
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
    }

    /**
     * 写入 max + 1 个键时只淘汰最早写入的那个
     */
    @Test
    public void testFifoEviction() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        l1.set(CacheDomain.AUTHOR, "k2", "v2");
        l1.set(CacheDomain.AUTHOR, "k3", "v3");
        l1.set(CacheDomain.AUTHOR, "k4", "v4");

        assertEquals(3, l1.size(CacheDomain.AUTHOR));
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
        assertEquals("v2", l1.get(CacheDomain.AUTHOR, "k2"));
        assertEquals("v3", l1.get(CacheDomain.AUTHOR, "k3"));
        assertEquals("v4", l1.get(CacheDomain.AUTHOR, "k4"));
    }

    /**
     * 淘汰按插入顺序而不是访问顺序
     */
    @Test
    public void testEvictionIgnoresAccessRecency() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        l1.set(CacheDomain.AUTHOR, "k2", "v2");
        l1.set(CacheDomain.AUTHOR, "k3", "v3");

        // 频繁访问 k1 也不能让它免于淘汰
        l1.get(CacheDomain.AUTHOR, "k1");
        l1.get(CacheDomain.AUTHOR, "k1");

        l1.set(CacheDomain.AUTHOR, "k4", "v4");
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
        assertEquals("v2", l1.get(CacheDomain.AUTHOR, "k2"));
    }

    /**
     * 覆盖已有键不触发淘汰，也不改变它的插入位置
     */
    @Test
    public void testOverwriteDoesNotEvict() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        l1.set(CacheDomain.AUTHOR, "k2", "v2");
        l1.set(CacheDomain.AUTHOR, "k3", "v3");

        l1.set(CacheDomain.AUTHOR, "k1", "v1-new");
        assertEquals(3, l1.size(CacheDomain.AUTHOR));
        assertEquals("v1-new", l1.get(CacheDomain.AUTHOR, "k1"));

        l1.set(CacheDomain.AUTHOR, "k4", "v4");
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
        assertEquals("v2", l1.get(CacheDomain.AUTHOR, "k2"));
    }

    /**
     * 覆盖写刷新过期时间
     */
    @Test
    public void testOverwriteRefreshesExpiry() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        clock.advanceMillis(TTL_MS - 100);
        l1.set(CacheDomain.AUTHOR, "k1", "v2");
        clock.advanceMillis(500);
        assertEquals("v2", l1.get(CacheDomain.AUTHOR, "k1"));
    }

    /**
     * 超过大小上限的值不进入 L1
     */
    @Test
    public void testOversizedValueSkipped() {
        l1.set(CacheDomain.MARKDOWN, "small", "0123456789");
        l1.set(CacheDomain.MARKDOWN, "large", "0123456789A");

        assertEquals("0123456789", l1.get(CacheDomain.MARKDOWN, "small"));
        assertNull(l1.get(CacheDomain.MARKDOWN, "large"));
    }

    /**
     * 大小按 UTF-8 字节计算
     */
    @Test
    public void testValueSizeCountsUtf8Bytes() {
        // 4 个汉字 = 12 字节
        l1.set(CacheDomain.MARKDOWN, "cjk", "缓存测试");
        assertNull(l1.get(CacheDomain.MARKDOWN, "cjk"));
    }

    @Test
    public void testDisabledDomainIsNoop() {
        l1.set(CacheDomain.USER_HOME, "k1", "v1");
        assertNull(l1.get(CacheDomain.USER_HOME, "k1"));
        assertEquals(0, l1.size(CacheDomain.USER_HOME));
    }

    @Test
    public void testDelete() {
        l1.set(CacheDomain.AUTHOR, "k1", "v1");
        l1.delete(CacheDomain.AUTHOR, "k1");
        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));

        // 删除不存在的键是安全的
        l1.delete(CacheDomain.AUTHOR, "missing");
    }

    /**
     * 清空只影响指定域
     */
    @Test
    public void testClearIsolatedToDomain() {
        l1.set(CacheDomain.AUTHOR, "k1", "a");
        l1.set(CacheDomain.AUTHOR, "k2", "b");
        l1.set(CacheDomain.SIDEBAR, "k1", "c");

        l1.clear(CacheDomain.AUTHOR);

        assertNull(l1.get(CacheDomain.AUTHOR, "k1"));
        assertNull(l1.get(CacheDomain.AUTHOR, "k2"));
        assertEquals("c", l1.get(CacheDomain.SIDEBAR, "k1"));
    }

    @Test
    public void testSameKeyDifferentDomains() {
        l1.set(CacheDomain.AUTHOR, "same", "author");
        l1.set(CacheDomain.SIDEBAR, "same", "sidebar");

        assertEquals("author", l1.get(CacheDomain.AUTHOR, "same"));
        assertEquals("sidebar", l1.get(CacheDomain.SIDEBAR, "same"));
    }

    @Test(expected = UnknownCacheDomainException.class)
    public void testUnregisteredDomainFailsFast() {
        l1.set(CacheDomain.ALBUM_LIST, "k1", "v1");
    }
}
