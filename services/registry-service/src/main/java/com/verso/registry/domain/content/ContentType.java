package com.verso.registry.domain.content;

public enum ContentType {
    BOOK,
    CHAPTER,
    ARTICLE,
    CATEGORY
}
