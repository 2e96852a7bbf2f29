package cn.bafuka.tiercache.transport.impl;

import cn.bafuka.tiercache.exception.RemoteTierException.FailureReason;
import cn.bafuka.tiercache.transport.RemoteReply;
import cn.bafuka.tiercache.transport.RemoteTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Locale;

/**
 * 基于 Spring Data Redis 的远程缓存传输实现
 * 直连 Redis 时使用，支持的命令与 REST 网关一致：GET、SET ... EX、INCR、DEL
 */
@Slf4j
public class RedisTemplateRemoteTransport implements RemoteTransport {

    private final StringRedisTemplate redisTemplate;

    public RedisTemplateRemoteTransport(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public RemoteReply execute(String... command) {
        if (command == null || command.length < 2) {
            return RemoteReply.failed(FailureReason.UNSUPPORTED_COMMAND, "命令参数不足");
        }

        String name = command[0].toUpperCase(Locale.ROOT);
        String key = command[1];
        try {
            switch (name) {
                case "GET":
                    return RemoteReply.ok(redisTemplate.opsForValue().get(key));
                case "SET":
                    return set(command);
                case "INCR":
                    return RemoteReply.ok(redisTemplate.opsForValue().increment(key));
                case "DEL":
                    Boolean deleted = redisTemplate.delete(key);
                    return RemoteReply.ok(Boolean.TRUE.equals(deleted) ? 1L : 0L);
                default:
                    return RemoteReply.failed(FailureReason.UNSUPPORTED_COMMAND, "不支持的命令: " + name);
            }
        } catch (RuntimeException e) {
            log.debug("Redis 命令失败: command={}, key={}", name, key, e);
            return RemoteReply.failed(FailureReason.REDIS_ERROR, "Redis 错误: " + e.getMessage(), e);
        }
    }

    private RemoteReply set(String[] command) {
        if (command.length < 3) {
            return RemoteReply.failed(FailureReason.UNSUPPORTED_COMMAND, "SET 缺少值参数");
        }
        String key = command[1];
        String value = command[2];
        if (command.length >= 5 && "EX".equalsIgnoreCase(command[3])) {
            long seconds;
            try {
                seconds = Long.parseLong(command[4]);
            } catch (NumberFormatException e) {
                return RemoteReply.failed(FailureReason.UNSUPPORTED_COMMAND, "EX 参数不是整数: " + command[4]);
            }
            redisTemplate.opsForValue().set(key, value, Duration.ofSeconds(seconds));
        } else {
            redisTemplate.opsForValue().set(key, value);
        }
        return RemoteReply.ok("OK");
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String getType() {
        return "redis";
    }
}
