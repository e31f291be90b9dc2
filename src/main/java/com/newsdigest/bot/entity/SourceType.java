package com.newsdigest.bot.entity;

/**
 * 뉴스 소스 유형
 */
public enum SourceType {
    RSS("rss"),
    WEBSITE("website"),
    TELEGRAM_CHANNEL("telegram_channel");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SourceType fromValue(String value) {
        for (SourceType type : SourceType.values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
