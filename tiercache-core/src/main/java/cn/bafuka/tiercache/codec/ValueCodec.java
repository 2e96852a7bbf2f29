package cn.bafuka.tiercache.codec;

import java.lang.reflect.Type;

/**
 * 缓存值编解码器
 * L1 和 L2 中保存的都是编码后的文本
 */
public interface ValueCodec {

    /**
     * 编码
     *
     * @param value 待缓存的值
     * @return 编码后的文本
     * @throws cn.bafuka.tiercache.exception.CacheCodecException 无法编码
     */
    String encode(Object value);

    /**
     * 解码
     *
     * @param encoded 编码后的文本
     * @param type    目标类型
     * @return 解码后的值
     * @throws cn.bafuka.tiercache.exception.CacheCodecException 内容损坏或与目标类型不匹配
     */
    <T> T decode(String encoded, Type type);
}
