package cn.bafuka.tiercache.example.service;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.example.entity.Author;
import cn.bafuka.tiercache.example.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 作者资料服务
 * 演示单键的旁路缓存：先读缓存，未命中再加载并回写，更新后失效
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorService {

    static final String PROFILE_KEY = "profile";

    private final TieredCache tieredCache;

    private final ProfileRepository profileRepository;

    public Author getAuthor() {
        Author cached = tieredCache.get(CacheDomain.AUTHOR, PROFILE_KEY, Author.class);
        if (cached != null) {
            return cached;
        }

        log.info("从存储加载作者资料");
        Author author = profileRepository.loadAuthor();
        if (author != null) {
            tieredCache.set(CacheDomain.AUTHOR, PROFILE_KEY, author);
        }
        return author;
    }

    public void updateAuthor(Author author) {
        profileRepository.saveAuthor(author);
        tieredCache.invalidate(CacheDomain.AUTHOR, PROFILE_KEY);
        log.info("作者资料已更新: name={}", author.getName());
    }
}
