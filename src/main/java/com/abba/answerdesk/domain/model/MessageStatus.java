package com.abba.answerdesk.domain.model;

public enum MessageStatus {
    PENDING,
    PROCESSING,
    ANSWERED,
    IGNORED;

    public boolean isTerminal() {
        return this == ANSWERED || this == IGNORED;
    }

    public boolean canTransitionTo(MessageStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return next.ordinal() > this.ordinal();
    }
}
