package cn.bafuka.tiercache.example.service;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.example.entity.SiteSettings;
import cn.bafuka.tiercache.example.repository.ProfileRepository;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * SiteSettingsService 单元测试
 */
public class SiteSettingsServiceTest {

    @Mock
    private TieredCache tieredCache;

    @Mock
    private ProfileRepository profileRepository;

    @InjectMocks
    private SiteSettingsService siteSettingsService;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testCacheHit() {
        SiteSettings cached = new SiteSettings();
        cached.setTitle("cached");
        when(tieredCache.get(CacheDomain.SITE_SETTINGS, "default", SiteSettings.class)).thenReturn(cached);

        assertEquals("cached", siteSettingsService.getSettings().getTitle());
        verifyNoInteractions(profileRepository);
    }

    @Test
    public void testMissLoadsAndCaches() {
        SiteSettings stored = new SiteSettings();
        stored.setTitle("stored");
        when(profileRepository.loadSiteSettings()).thenReturn(stored);

        assertSame(stored, siteSettingsService.getSettings());
        verify(tieredCache).set(CacheDomain.SITE_SETTINGS, "default", stored);
    }

    /**
     * 加载失败时返回并缓存默认设置
     */
    @Test
    public void testLoaderFailureFallsBackToDefaults() {
        when(profileRepository.loadSiteSettings()).thenThrow(new IllegalStateException("storage down"));

        SiteSettings settings = siteSettingsService.getSettings();

        assertEquals(new SiteSettings(), settings);
        verify(tieredCache).set(CacheDomain.SITE_SETTINGS, "default", settings);
    }

    @Test
    public void testUpdateInvalidates() {
        siteSettingsService.updateSettings(new SiteSettings());
        verify(tieredCache).invalidate(CacheDomain.SITE_SETTINGS, "default");
    }
}
