package cn.bafuka.tiercache.example.controller;

import cn.bafuka.tiercache.example.entity.Article;
import cn.bafuka.tiercache.example.service.ArticleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 文章控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/articles")
public class ArticleController {

    @Autowired
    private ArticleService articleService;

    /**
     * 分页查询文章
     */
    @GetMapping
    public Map<String, Object> list(@RequestParam(required = false) String category,
                                    @RequestParam(defaultValue = "1") int page,
                                    @RequestParam(defaultValue = "10") int size) {
        List<Article> articles = articleService.listArticles(category, page, size);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", articles);
        result.put("total", articles.size());
        return result;
    }

    @GetMapping("/{id}")
    public Map<String, Object> detail(@PathVariable Long id) {
        Article article = articleService.getArticle(id);
        Map<String, Object> result = new HashMap<>();
        result.put("success", article != null);
        result.put("data", article);
        if (article == null) {
            result.put("message", "文章不存在: " + id);
        }
        return result;
    }

    /**
     * 发布文章
     */
    @PostMapping
    public Map<String, Object> publish(@RequestBody Article article) {
        Article saved = articleService.publish(article);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", saved);
        result.put("message", "文章发布成功");
        return result;
    }
}
