package com.newsdigest.bot.exception;

import com.newsdigest.bot.entity.ItemState;

public class InvalidTransitionException extends StoreInvariantViolationException {

    private final ItemState from;
    private final ItemState to;

    public InvalidTransitionException(String sourceId, String itemKey, ItemState from, ItemState to) {
        super("INVALID_TRANSITION",
                String.format("Invalid state transition %s -> %s for item %s/%s", from, to, sourceId, itemKey));
        this.from = from;
        this.to = to;
    }

    public ItemState getFrom() {
        return from;
    }

    public ItemState getTo() {
        return to;
    }
}
