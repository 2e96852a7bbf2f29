package cn.bafuka.tiercache.example.service;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.example.entity.SiteSettings;
import cn.bafuka.tiercache.example.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 站点设置服务
 * 存储不可用时使用默认设置，默认设置同样写入缓存
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SiteSettingsService {

    static final String SETTINGS_KEY = "default";

    private final TieredCache tieredCache;

    private final ProfileRepository profileRepository;

    public SiteSettings getSettings() {
        SiteSettings cached = tieredCache.get(CacheDomain.SITE_SETTINGS, SETTINGS_KEY, SiteSettings.class);
        if (cached != null) {
            return cached;
        }

        SiteSettings settings;
        try {
            settings = profileRepository.loadSiteSettings();
        } catch (RuntimeException e) {
            log.warn("加载站点设置失败，使用默认设置", e);
            settings = null;
        }
        if (settings == null) {
            settings = new SiteSettings();
        }
        tieredCache.set(CacheDomain.SITE_SETTINGS, SETTINGS_KEY, settings);
        return settings;
    }

    public void updateSettings(SiteSettings settings) {
        profileRepository.saveSiteSettings(settings);
        tieredCache.invalidate(CacheDomain.SITE_SETTINGS, SETTINGS_KEY);
    }
}
