package cn.bafuka.tiercache.example.entity;

import lombok.Data;

/**
 * 作者信息
 */
@Data
public class Author {

    private String name;

    private String bio;

    private String avatar;
}
