package cn.bafuka.tiercache.transport;

import cn.bafuka.tiercache.transport.impl.DisabledRemoteTransport;
import cn.bafuka.tiercache.transport.impl.RestRemoteTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * 远程传输工厂
 * 配置只解析一次：地址或 Token 缺失时返回永久禁用的传输，不重试、不重连
 */
@Slf4j
public final class RemoteTransports {

    public static final String URL_ENV = "KV_REST_API_URL";

    public static final String TOKEN_ENV = "KV_REST_API_TOKEN";

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(3);

    private RemoteTransports() {
    }

    /**
     * 根据地址和 Token 创建 REST 传输
     *
     * @return 配置完整时返回 RestRemoteTransport，否则返回 DisabledRemoteTransport
     */
    public static RemoteTransport rest(String url, String token, Duration connectTimeout, Duration requestTimeout) {
        String trimmedUrl = url == null ? "" : url.trim();
        String trimmedToken = token == null ? "" : token.trim();
        if (trimmedUrl.isEmpty() || trimmedToken.isEmpty()) {
            log.warn("未配置远程缓存地址或 Token，L2 已禁用，仅使用本地缓存");
            return DisabledRemoteTransport.INSTANCE;
        }

        URI endpoint;
        try {
            endpoint = URI.create(trimmedUrl);
        } catch (IllegalArgumentException e) {
            log.warn("远程缓存地址无效，L2 已禁用: url={}", trimmedUrl, e);
            return DisabledRemoteTransport.INSTANCE;
        }
        if (!isHttpScheme(endpoint.getScheme()) || endpoint.getHost() == null) {
            log.warn("远程缓存地址无效（仅支持 http/https），L2 已禁用: url={}", trimmedUrl);
            return DisabledRemoteTransport.INSTANCE;
        }

        log.info("远程缓存已启用: endpoint={}", endpoint);
        return RestRemoteTransport.create(endpoint, trimmedToken,
                connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT,
                requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * 从环境变量创建 REST 传输（读取 KV_REST_API_URL / KV_REST_API_TOKEN）
     *
     * @param environment 环境变量，通常为 System.getenv()
     */
    public static RemoteTransport fromEnvironment(Map<String, String> environment) {
        return rest(environment.get(URL_ENV), environment.get(TOKEN_ENV),
                DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    private static boolean isHttpScheme(String scheme) {
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }
}
