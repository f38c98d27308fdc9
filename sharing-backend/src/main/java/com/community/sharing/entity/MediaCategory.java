package com.community.sharing.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 媒体内容分类（固定集合）。
 * 对外一律使用小写取值，入参按精确匹配校验，不做大小写转换。
 */
public enum MediaCategory {
    GAME("game"),
    VIDEO("video"),
    ARTWORK("artwork"),
    MUSIC("music");

    private final String value;

    MediaCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<MediaCategory> fromValue(String value) {
        return Arrays.stream(values())
                .filter(category -> category.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values())
                .map(MediaCategory::getValue)
                .collect(Collectors.toList());
    }
}
