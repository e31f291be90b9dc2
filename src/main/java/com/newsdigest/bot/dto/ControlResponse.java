package com.newsdigest.bot.dto;

import com.newsdigest.bot.service.ControlResult;

public record ControlResponse(
        String command,
        ControlResult result,
        boolean paused
) {}
