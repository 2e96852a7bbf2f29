package cn.bafuka.tiercache.exception;

/**
 * 远程缓存访问异常
 * 仅用于描述失败原因，由传输层包装进 RemoteReply，不会抛给缓存调用方
 *
 * @author TierCache Team
 * @since 1.0
 */
public class RemoteTierException extends RuntimeException {

    /**
     * 失败原因
     */
    private final FailureReason reason;

    public RemoteTierException(String message, Throwable cause, FailureReason reason) {
        super(message, cause);
        this.reason = reason;
    }

    public RemoteTierException(String message, FailureReason reason) {
        this(message, null, reason);
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 远程访问失败原因枚举
     */
    public enum FailureReason {
        /**
         * 网络错误
         */
        NETWORK_ERROR("网络错误"),

        /**
         * 超时错误
         */
        TIMEOUT("超时"),

        /**
         * 线程被中断
         */
        INTERRUPTED("线程中断"),

        /**
         * 非 2xx 状态码
         */
        HTTP_STATUS("HTTP 状态码异常"),

        /**
         * 请求无法构造（地址协议或请求头非法）
         */
        MALFORMED_REQUEST("请求格式错误"),

        /**
         * 响应体无法解析
         */
        MALFORMED_RESPONSE("响应格式错误"),

        /**
         * 远端明确拒绝了命令（如值过大）
         */
        REJECTED("远端拒绝"),

        /**
         * Redis 错误
         */
        REDIS_ERROR("Redis 错误"),

        /**
         * 不支持的命令
         */
        UNSUPPORTED_COMMAND("不支持的命令");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "RemoteTierException{" +
                "reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
