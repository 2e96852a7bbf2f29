package cn.bafuka.tiercache.support;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内的 Redis REST 网关模拟（测试用）
 * 请求体 [COMMAND, ...args]，响应 {"result": ...}，支持 GET / SET EX / INCR / DEL
 */
public class FakeRestGateway implements Closeable {

    private final String token;

    private final HttpServer server;

    private final Map<String, String> store = new ConcurrentHashMap<>();

    private final Map<String, Long> expirySeconds = new ConcurrentHashMap<>();

    private final List<List<String>> commands = new CopyOnWriteArrayList<>();

    private final List<String> authorizations = new CopyOnWriteArrayList<>();

    private final List<String> contentTypes = new CopyOnWriteArrayList<>();

    private volatile int forcedStatus;

    private volatile String forcedBody;

    private volatile int maxValueSize = Integer.MAX_VALUE;

    public FakeRestGateway(String token) throws IOException {
        this.token = token;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        this.server.createContext("/", this::handle);
        this.server.start();
    }

    public String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    public Map<String, String> store() {
        return store;
    }

    public Long ttlOf(String key) {
        return expirySeconds.get(key);
    }

    public List<List<String>> commands() {
        return Collections.unmodifiableList(commands);
    }

    public List<String> authorizations() {
        return authorizations;
    }

    public List<String> contentTypes() {
        return contentTypes;
    }

    /**
     * 后续所有请求都返回指定状态码和响应体
     */
    public void forceResponse(int status, String body) {
        this.forcedStatus = status;
        this.forcedBody = body;
    }

    /**
     * 拒绝超过指定大小的 SET（模拟托管服务的请求体积上限）
     */
    public void rejectValuesLargerThan(int bytes) {
        this.maxValueSize = bytes;
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
        contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));

        if (forcedBody != null) {
            respond(exchange, forcedStatus, forcedBody);
            return;
        }

        if (!("Bearer " + token).equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
            respond(exchange, 401, "{\"error\":\"Unauthorized\"}");
            return;
        }

        List<String> command = new ArrayList<>(JSON.parseArray(body, String.class));
        commands.add(command);

        String name = command.get(0).toUpperCase();
        String key = command.size() > 1 ? command.get(1) : null;
        switch (name) {
            case "GET":
                result(exchange, store.get(key));
                break;
            case "SET":
                String value = command.get(2);
                if (value.getBytes(StandardCharsets.UTF_8).length > maxValueSize) {
                    respond(exchange, 400, "{\"error\":\"ERR max request size exceeded\"}");
                    return;
                }
                store.put(key, value);
                if (command.size() >= 5 && "EX".equalsIgnoreCase(command.get(3))) {
                    expirySeconds.put(key, Long.parseLong(command.get(4)));
                }
                result(exchange, "OK");
                break;
            case "INCR":
                long next = Long.parseLong(store.getOrDefault(key, "0")) + 1;
                store.put(key, String.valueOf(next));
                result(exchange, next);
                break;
            case "DEL":
                expirySeconds.remove(key);
                result(exchange, store.remove(key) != null ? 1 : 0);
                break;
            default:
                respond(exchange, 400, "{\"error\":\"ERR unknown command '" + name + "'\"}");
        }
    }

    private void result(HttpExchange exchange, Object result) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("result", result);
        respond(exchange, 200, JSON.toJSONString(payload, SerializerFeature.WriteMapNullValue));
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
