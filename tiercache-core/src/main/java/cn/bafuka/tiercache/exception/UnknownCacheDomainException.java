package cn.bafuka.tiercache.exception;

/**
 * 未知缓存域异常
 * 属于调用方编程错误，直接抛出而不是静默降级
 */
public class UnknownCacheDomainException extends IllegalArgumentException {

    /**
     * 未能识别的域
     */
    private final String domain;

    public UnknownCacheDomainException(String domain) {
        super("未知的缓存域: " + domain);
        this.domain = domain;
    }

    public String getDomain() {
        return domain;
    }
}
