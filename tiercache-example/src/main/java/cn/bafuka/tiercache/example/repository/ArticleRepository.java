package cn.bafuka.tiercache.example.repository;

import cn.bafuka.tiercache.example.entity.Article;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 文章存储（内存实现，代替数据库）
 */
@Repository
public class ArticleRepository {

    private final Map<Long, Article> articles = new ConcurrentHashMap<>();

    private final AtomicLong idGenerator = new AtomicLong();

    public Article findById(Long id) {
        return articles.get(id);
    }

    /**
     * 分页查询已发布文章，按 id 倒序
     */
    public List<Article> findPublished(String category, int page, int size) {
        return articles.values().stream()
                .filter(Article::isPublished)
                .filter(a -> category == null || category.equals(a.getCategory()))
                .sorted(Comparator.comparing(Article::getId).reversed())
                .skip((long) Math.max(page - 1, 0) * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    public Article save(Article article) {
        if (article.getId() == null) {
            article.setId(idGenerator.incrementAndGet());
        }
        articles.put(article.getId(), article);
        return article;
    }
}
