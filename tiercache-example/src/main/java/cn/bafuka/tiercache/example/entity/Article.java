package cn.bafuka.tiercache.example.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 文章
 */
@Data
public class Article {

    private Long id;

    private String title;

    private String category;

    private String content;

    private boolean published;

    private LocalDateTime publishTime;
}
