package cn.bafuka.tiercache.transport;

import cn.bafuka.tiercache.exception.RemoteTierException;
import cn.bafuka.tiercache.exception.RemoteTierException.FailureReason;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * 远程命令执行结果
 * 传输层不抛异常，成功、失败、未启用三种情况都通过该类型返回，
 * 由调用方统一决定失败时按未命中处理
 */
public final class RemoteReply {

    private static final RemoteReply DISABLED = new RemoteReply(Status.DISABLED, null, null);

    private static final RemoteReply OK_NULL = new RemoteReply(Status.OK, null, null);

    /**
     * 结果状态
     */
    public enum Status {
        /**
         * 命令执行成功（结果可能为 null）
         */
        OK,

        /**
         * 远程缓存已配置，但本次调用失败
         */
        FAILED,

        /**
         * 远程缓存未配置或该域未启用 L2
         */
        DISABLED
    }

    private final Status status;

    private final Object result;

    private final RemoteTierException error;

    private RemoteReply(Status status, Object result, RemoteTierException error) {
        this.status = status;
        this.result = result;
        this.error = error;
    }

    public static RemoteReply ok(Object result) {
        return result == null ? OK_NULL : new RemoteReply(Status.OK, result, null);
    }

    public static RemoteReply failed(FailureReason reason, String message) {
        return failed(new RemoteTierException(message, reason));
    }

    public static RemoteReply failed(FailureReason reason, String message, Throwable cause) {
        return failed(new RemoteTierException(message, cause, reason));
    }

    public static RemoteReply failed(RemoteTierException error) {
        return new RemoteReply(Status.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public static RemoteReply disabled() {
        return DISABLED;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isDisabled() {
        return status == Status.DISABLED;
    }

    /**
     * 原始结果，仅在 OK 时可能非空
     */
    public Object getResult() {
        return result;
    }

    /**
     * 失败详情，仅在 FAILED 时非空
     */
    public RemoteTierException getError() {
        return error;
    }

    /**
     * 结果的字符串形式
     *
     * @return 成功且结果非空时返回字符串，否则返回 null
     */
    public String asString() {
        if (!isOk() || result == null) {
            return null;
        }
        return result instanceof String ? (String) result : String.valueOf(result);
    }

    /**
     * 结果的整数形式
     *
     * @return 成功且结果可解析为整数时返回该值，否则为空
     */
    public OptionalLong asLong() {
        if (!isOk() || result == null) {
            return OptionalLong.empty();
        }
        if (result instanceof Number && !(result instanceof Double) && !(result instanceof Float)) {
            return OptionalLong.of(((Number) result).longValue());
        }
        try {
            return OptionalLong.of(Long.parseLong(String.valueOf(result).trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public String toString() {
        switch (status) {
            case OK:
                return "RemoteReply{OK, result=" + result + '}';
            case FAILED:
                return "RemoteReply{FAILED, reason=" + error.getReason() + ", message=" + error.getMessage() + '}';
            default:
                return "RemoteReply{DISABLED}";
        }
    }
}
