package cn.bafuka.tiercache.support;

import cn.bafuka.tiercache.core.CacheDomain;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * CacheKeys 单元测试
 */
public class CacheKeysTest {

    /**
     * 键格式必须与其他进程逐字节一致
     */
    @Test
    public void testKeyFormats() {
        assertEquals("v1:author:__ver__", CacheKeys.versionKey(CacheDomain.AUTHOR));
        assertEquals("v1:article-list:v0:page1", CacheKeys.dataKey(CacheDomain.ARTICLE_LIST, 0, "page1"));
        assertEquals("v1:markdown:v42:post:7", CacheKeys.dataKey(CacheDomain.MARKDOWN, 42, "post:7"));
    }

    @Test
    public void testDataKeyDependsOnEveryPart() {
        String base = CacheKeys.dataKey(CacheDomain.AUTHOR, 1, "u1");
        assertNotEquals(base, CacheKeys.dataKey(CacheDomain.USER_HOME, 1, "u1"));
        assertNotEquals(base, CacheKeys.dataKey(CacheDomain.AUTHOR, 2, "u1"));
        assertNotEquals(base, CacheKeys.dataKey(CacheDomain.AUTHOR, 1, "u2"));
        assertEquals(base, CacheKeys.dataKey(CacheDomain.AUTHOR, 1, "u1"));
    }

    /**
     * 参数哈希与插入顺序无关
     */
    @Test
    public void testHashParamsIgnoresOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("page", 2);
        first.put("size", 20);
        first.put("tag", "java");

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("tag", "java");
        second.put("size", 20);
        second.put("page", 2);

        String hash = CacheKeys.hashParams(first);
        assertEquals(hash, CacheKeys.hashParams(second));
        assertEquals(16, hash.length());
        assertTrue(hash.matches("[0-9a-f]{16}"));
    }

    @Test
    public void testHashParamsDistinguishesValues() {
        Map<String, Object> page1 = new HashMap<>();
        page1.put("page", 1);
        Map<String, Object> page2 = new HashMap<>();
        page2.put("page", 2);

        assertNotEquals(CacheKeys.hashParams(page1), CacheKeys.hashParams(page2));
    }

    @Test
    public void testHashParamsEmpty() {
        assertEquals(CacheKeys.hashParams(null), CacheKeys.hashParams(new HashMap<>()));
    }
}
