package cn.bafuka.tiercache.example.service;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.example.entity.Article;
import cn.bafuka.tiercache.example.repository.ArticleRepository;
import cn.bafuka.tiercache.support.CacheKeys;
import com.alibaba.fastjson.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文章服务
 * 列表按查询参数的哈希缓存，发布文章时整域失效所有列表页
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleService {

    private static final TypeReference<List<Article>> ARTICLE_LIST_TYPE = new TypeReference<List<Article>>() {
    };

    private final TieredCache tieredCache;

    private final ArticleRepository articleRepository;

    /**
     * 分页查询已发布文章
     *
     * @param category 分类，为 null 表示全部
     * @param page     页码，从 1 开始
     * @param size     每页条数
     */
    public List<Article> listArticles(String category, int page, int size) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("category", category);
        params.put("page", page);
        params.put("size", size);
        String key = CacheKeys.hashParams(params);

        List<Article> cached = tieredCache.get(CacheDomain.ARTICLE_LIST, key, ARTICLE_LIST_TYPE);
        if (cached != null) {
            return cached;
        }

        log.info("从存储查询文章列表: category={}, page={}, size={}", category, page, size);
        List<Article> articles = articleRepository.findPublished(category, page, size);
        tieredCache.set(CacheDomain.ARTICLE_LIST, key, articles);
        return articles;
    }

    public Article getArticle(Long id) {
        String key = String.valueOf(id);
        Article cached = tieredCache.get(CacheDomain.ARTICLE_DETAIL, key, Article.class);
        if (cached != null) {
            return cached;
        }

        log.info("从存储查询文章: id={}", id);
        Article article = articleRepository.findById(id);
        if (article != null) {
            tieredCache.set(CacheDomain.ARTICLE_DETAIL, key, article);
        }
        return article;
    }

    /**
     * 保存并发布文章
     * 列表页数量不确定，整域失效；详情只失效这一篇
     */
    public Article publish(Article article) {
        article.setPublished(true);
        article.setPublishTime(LocalDateTime.now());
        Article saved = articleRepository.save(article);

        tieredCache.invalidateByDomain(CacheDomain.ARTICLE_LIST);
        tieredCache.invalidate(CacheDomain.ARTICLE_DETAIL, String.valueOf(saved.getId()));
        log.info("文章已发布: id={}, title={}", saved.getId(), saved.getTitle());
        return saved;
    }
}
