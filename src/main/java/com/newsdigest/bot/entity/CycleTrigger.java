package com.newsdigest.bot.entity;

public enum CycleTrigger {
    SCHEDULED,
    MANUAL,
    STARTUP
}
