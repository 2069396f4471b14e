package com.abba.answerdesk.application.service;

public record DispatchResult(int fetched, int persisted, int duplicates, int failed) {

    public static DispatchResult empty() {
        return new DispatchResult(0, 0, 0, 0);
    }
}
