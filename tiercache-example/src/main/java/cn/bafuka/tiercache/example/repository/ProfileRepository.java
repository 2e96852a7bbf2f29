package cn.bafuka.tiercache.example.repository;

import cn.bafuka.tiercache.example.entity.Author;
import cn.bafuka.tiercache.example.entity.SiteSettings;
import org.springframework.stereotype.Repository;

/**
 * 作者资料和站点设置存储（内存实现）
 */
@Repository
public class ProfileRepository {

    private volatile Author author;

    private volatile SiteSettings siteSettings;

    public ProfileRepository() {
        Author initial = new Author();
        initial.setName("Ada");
        initial.setBio("Writes about caches.");
        this.author = initial;
        this.siteSettings = new SiteSettings();
    }

    public Author loadAuthor() {
        return author;
    }

    public void saveAuthor(Author author) {
        this.author = author;
    }

    public SiteSettings loadSiteSettings() {
        return siteSettings;
    }

    public void saveSiteSettings(SiteSettings siteSettings) {
        this.siteSettings = siteSettings;
    }
}
