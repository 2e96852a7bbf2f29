package cn.bafuka.tiercache.support;

import cn.bafuka.tiercache.core.CacheDomain;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 缓存键构建工具
 * 键格式需与共享同一远程缓存的其他进程逐字节一致：
 * 版本号键 v1:&lt;domain&gt;:__ver__，数据键 v1:&lt;domain&gt;:v&lt;generation&gt;:&lt;key&gt;
 */
public final class CacheKeys {

    private static final String KEY_SCHEMA = "v1";

    private static final int PARAMS_HASH_LENGTH = 16;

    private CacheKeys() {
    }

    /**
     * 域版本号计数器键
     */
    public static String versionKey(CacheDomain domain) {
        Objects.requireNonNull(domain, "domain");
        return KEY_SCHEMA + ":" + domain.getLabel() + ":__ver__";
    }

    /**
     * 完整数据键
     *
     * @param domain     缓存域
     * @param generation 域版本号
     * @param key        调用方键
     */
    public static String dataKey(CacheDomain domain, long generation, String key) {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(key, "key");
        return KEY_SCHEMA + ":" + domain.getLabel() + ":v" + generation + ":" + key;
    }

    /**
     * 将参数对象哈希为 16 位十六进制字符串，用于构建列表类缓存的调用方键
     * 参数按键名排序后序列化，与参数的插入顺序无关
     *
     * @param params 查询参数
     * @return SHA-256 摘要的前 16 个十六进制字符
     */
    public static String hashParams(Map<String, ?> params) {
        Map<String, Object> sorted = new TreeMap<>();
        if (params != null) {
            sorted.putAll(params);
        }
        String json = JSON.toJSONString(sorted, SerializerFeature.MapSortField, SerializerFeature.WriteMapNullValue);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, PARAMS_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
