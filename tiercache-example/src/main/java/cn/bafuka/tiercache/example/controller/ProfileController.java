package cn.bafuka.tiercache.example.controller;

import cn.bafuka.tiercache.example.entity.Author;
import cn.bafuka.tiercache.example.service.AuthorService;
import cn.bafuka.tiercache.example.service.SiteSettingsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 作者资料和站点设置
 */
@RestController
@RequestMapping("/api")
public class ProfileController {

    @Autowired
    private AuthorService authorService;

    @Autowired
    private SiteSettingsService siteSettingsService;

    @GetMapping("/author")
    public Map<String, Object> author() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", authorService.getAuthor());
        return result;
    }

    @PutMapping("/author")
    public Map<String, Object> updateAuthor(@RequestBody Author author) {
        authorService.updateAuthor(author);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "作者资料更新成功");
        return result;
    }

    @GetMapping("/settings")
    public Map<String, Object> settings() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", siteSettingsService.getSettings());
        return result;
    }
}
