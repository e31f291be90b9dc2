package com.newsdigest.bot.service;

public enum MarkResult {
    OK,
    NOT_FOUND
}
