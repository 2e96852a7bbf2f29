package cn.bafuka.tiercache.example.entity;

import lombok.Data;

/**
 * 站点设置
 */
@Data
public class SiteSettings {

    private String title = "TierCache Blog";

    private String description = "";

    private int pageSize = 10;

    private boolean commentsEnabled = true;
}
