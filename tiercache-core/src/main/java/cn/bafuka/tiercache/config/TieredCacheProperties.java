package cn.bafuka.tiercache.config;

import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.model.CacheStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TierCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "tiercache")
public class TieredCacheProperties {

    /**
     * 是否启用 TierCache
     */
    private boolean enabled = true;

    /**
     * 远程缓存（L2）配置
     */
    private Remote remote = new Remote();

    /**
     * 指标输出配置
     */
    private Metrics metrics = new Metrics();

    /**
     * 按域覆盖默认策略，键为域标签（如 article-list）
     */
    private Map<CacheDomain, StrategyOverride> strategies = new LinkedHashMap<>();

    /**
     * 在默认策略表的基础上应用覆盖项
     *
     * @return 策略表
     */
    public StrategyTable toStrategyTable() {
        StrategyTable.Builder builder = StrategyTable.builder();
        strategies.forEach((domain, override) -> {
            if (domain != null && override != null) {
                builder.strategy(domain, override.applyTo(builder.current(domain)));
            }
        });
        return builder.build();
    }

    /**
     * 远程传输方式
     */
    public enum RemoteMode {
        /**
         * HTTP REST 网关
         */
        REST,

        /**
         * Spring Data Redis 直连
         */
        REDIS
    }

    @Data
    public static class Remote {

        /**
         * 传输方式
         */
        private RemoteMode mode = RemoteMode.REST;

        /**
         * REST 网关地址，未配置时读取环境变量 KV_REST_API_URL
         */
        private String url;

        /**
         * REST 网关 Token，未配置时读取环境变量 KV_REST_API_TOKEN
         */
        private String token;

        /**
         * 连接超时
         */
        private Duration connectTimeout = Duration.ofSeconds(2);

        /**
         * 单次请求超时
         */
        private Duration requestTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Metrics {

        /**
         * 是否定时输出指标日志
         */
        private boolean enabled = true;

        /**
         * 输出间隔
         */
        private Duration flushInterval = Duration.ofMinutes(5);
    }

    /**
     * 单个域的策略覆盖项，未设置的字段沿用默认值
     */
    @Data
    public static class StrategyOverride {

        private Duration l1Ttl;

        private Duration l2Ttl;

        private Integer l1MaxEntries;

        private Integer l1MaxValueSize;

        CacheStrategy applyTo(CacheStrategy base) {
            CacheStrategy.CacheStrategyBuilder builder = base != null
                    ? base.toBuilder()
                    : CacheStrategy.builder();
            if (l1Ttl != null) {
                builder.l1TtlMs(l1Ttl.toMillis());
            }
            if (l2Ttl != null) {
                builder.l2TtlMs(l2Ttl.toMillis());
            }
            if (l1MaxEntries != null) {
                builder.l1MaxEntries(l1MaxEntries);
            }
            if (l1MaxValueSize != null) {
                builder.l1MaxValueSize(l1MaxValueSize);
            }
            return builder.build();
        }
    }
}
