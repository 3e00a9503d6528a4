package dev.pagecraft.entity;

import java.util.Arrays;
import java.util.Optional;

public enum ComponentType {
    TEXT("text"),
    MARKDOWN("markdown"),
    HTML("html"),
    CODE("code"),
    IMAGE("image"),
    CUSTOM("custom"),
    BLOG_SUMMARY("blog_summary");

    private final String value;

    ComponentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ComponentType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
