package cn.bafuka.tiercache.exception;

/**
 * 缓存值编解码异常
 * 写入时无法序列化，或读取到的内容无法反序列化为目标类型
 */
public class CacheCodecException extends RuntimeException {

    public CacheCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
