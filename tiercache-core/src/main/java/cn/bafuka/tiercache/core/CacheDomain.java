package cn.bafuka.tiercache.core;

import cn.bafuka.tiercache.exception.UnknownCacheDomainException;

/**
 * 缓存域
 * 每个域拥有独立的 TTL 策略、容量上限和版本号计数器
 * 域集合在编译期确定，label 为写入远程存储的键片段，跨进程必须保持一致
 */
public enum CacheDomain {

    AUTHOR("author"),
    SITE_SETTINGS("site-settings"),
    SIDEBAR("sidebar"),
    ARTICLE_LIST("article-list"),
    ARTICLE_DETAIL("article-detail"),
    DIARY_LIST("diary-list"),
    DIARY_DETAIL("diary-detail"),
    ALBUM_LIST("album-list"),
    ALBUM_DETAIL("album-detail"),
    USER_HOME("user-home"),
    MARKDOWN("markdown");

    private final String label;

    CacheDomain(String label) {
        this.label = label;
    }

    /**
     * 获取域标签（用于构建缓存键）
     *
     * @return 域标签，如 "article-list"
     */
    public String getLabel() {
        return label;
    }

    /**
     * 根据标签解析缓存域
     *
     * @param label 域标签
     * @return 缓存域
     * @throws UnknownCacheDomainException 标签不属于任何已知域
     */
    public static CacheDomain fromLabel(String label) {
        if (label != null) {
            for (CacheDomain domain : values()) {
                if (domain.label.equals(label)) {
                    return domain;
                }
            }
        }
        throw new UnknownCacheDomainException(label);
    }

    @Override
    public String toString() {
        return label;
    }
}
