package com.newsdigest.bot.service;

public enum InsertResult {
    INSERTED,
    ALREADY_EXISTS
}
