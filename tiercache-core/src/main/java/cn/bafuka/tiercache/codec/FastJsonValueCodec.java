package cn.bafuka.tiercache.codec;

import cn.bafuka.tiercache.exception.CacheCodecException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.serializer.SerializerFeature;

import java.lang.reflect.Type;

/**
 * 基于 fastjson 的 JSON 编解码器
 * 不写入类型信息，其他语言的进程也能读取同一份 L2 数据
 */
public class FastJsonValueCodec implements ValueCodec {

    @Override
    public String encode(Object value) {
        try {
            return JSON.toJSONString(value, SerializerFeature.DisableCircularReferenceDetect);
        } catch (JSONException e) {
            throw new CacheCodecException("缓存值无法序列化: " + value.getClass().getName(), e);
        } catch (StackOverflowError e) {
            // 关闭了循环引用检测，自引用的对象会无限递归
            throw new CacheCodecException("缓存值存在循环引用: " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(String encoded, Type type) {
        try {
            return JSON.parseObject(encoded, type);
        } catch (JSONException | ClassCastException | NumberFormatException e) {
            throw new CacheCodecException("缓存值无法反序列化为 " + type.getTypeName(), e);
        }
    }
}
