package cn.bafuka.tiercache.transport.impl;

import cn.bafuka.tiercache.exception.RemoteTierException.FailureReason;
import cn.bafuka.tiercache.transport.RemoteReply;
import cn.bafuka.tiercache.transport.RemoteTransport;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * 基于 HTTP REST 网关的远程缓存传输实现
 * 请求体为 JSON 数组 [COMMAND, ...args]，响应为 {"result": ...}，
 * 与常见的托管 Redis REST 网关（如 Upstash）保持一致
 */
@Slf4j
public class RestRemoteTransport implements RemoteTransport {

    private final URI endpoint;

    private final String token;

    private final HttpClient httpClient;

    private final Duration requestTimeout;

    public RestRemoteTransport(URI endpoint, String token, HttpClient httpClient, Duration requestTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.token = Objects.requireNonNull(token, "token");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * 使用默认 HttpClient 创建
     *
     * @param endpoint       网关地址
     * @param token          Bearer Token
     * @param connectTimeout 连接超时
     * @param requestTimeout 单次请求超时
     */
    public static RestRemoteTransport create(URI endpoint, String token,
                                             Duration connectTimeout, Duration requestTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        return new RestRemoteTransport(endpoint, token, httpClient, requestTimeout);
    }

    @Override
    public RemoteReply execute(String... command) {
        if (command == null || command.length == 0) {
            return RemoteReply.failed(FailureReason.UNSUPPORTED_COMMAND, "空命令");
        }

        String commandName = command[0];
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(requestTimeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(JSON.toJSONString(Arrays.asList(command)),
                            StandardCharsets.UTF_8))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            // 地址协议不受支持或 Token 含非法字符
            return failure(commandName, FailureReason.MALFORMED_REQUEST, "无法构造请求: " + e.getMessage(), e);
        } catch (HttpTimeoutException e) {
            return failure(commandName, FailureReason.TIMEOUT, "请求超时: " + e.getMessage(), e);
        } catch (IOException e) {
            return failure(commandName, FailureReason.NETWORK_ERROR, "网络错误: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(commandName, FailureReason.INTERRUPTED, "请求被中断", e);
        }

        return parseResponse(commandName, response.statusCode(), response.body());
    }

    /**
     * 解析网关响应
     *
     * @param commandName 命令名（用于日志）
     * @param statusCode  HTTP 状态码
     * @param body        响应体
     * @return 执行结果
     */
    private RemoteReply parseResponse(String commandName, int statusCode, String body) {
        JSONObject json;
        try {
            json = body == null || body.isEmpty() ? null : JSON.parseObject(body);
        } catch (JSONException | ClassCastException e) {
            json = null;
        }

        if (json != null && json.get("error") != null) {
            return failure(commandName, FailureReason.REJECTED,
                    "网关拒绝命令: status=" + statusCode + ", error=" + json.get("error"), null);
        }

        if (statusCode < 200 || statusCode >= 300) {
            return failure(commandName, FailureReason.HTTP_STATUS, "HTTP " + statusCode, null);
        }

        if (json == null || !json.containsKey("result")) {
            return failure(commandName, FailureReason.MALFORMED_RESPONSE, "无法解析响应: " + abbreviate(body), null);
        }

        return RemoteReply.ok(json.get("result"));
    }

    private RemoteReply failure(String commandName, FailureReason reason, String message, Throwable cause) {
        log.debug("远程缓存命令失败: command={}, reason={}, message={}", commandName, reason, message);
        return RemoteReply.failed(reason, message, cause);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "null";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String getType() {
        return "rest";
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
