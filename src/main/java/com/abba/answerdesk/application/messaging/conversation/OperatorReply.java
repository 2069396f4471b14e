package com.abba.answerdesk.application.messaging.conversation;

import java.util.List;

public record OperatorReply(String text, List<SuggestedAction> actions) {

    public record SuggestedAction(String label, String command) {
    }

    public static OperatorReply text(String text) {
        return new OperatorReply(text, List.of());
    }

    public static OperatorReply withActions(String text, SuggestedAction... actions) {
        return new OperatorReply(text, List.of(actions));
    }
}
