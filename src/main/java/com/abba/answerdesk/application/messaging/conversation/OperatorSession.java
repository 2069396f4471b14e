package com.abba.answerdesk.application.messaging.conversation;

public record OperatorSession(SessionState state, String targetId) {

    private static final OperatorSession IDLE = new OperatorSession(SessionState.IDLE, null);

    public static OperatorSession idle() {
        return IDLE;
    }

    public static OperatorSession awaitingManualResponse(String messageId) {
        return new OperatorSession(SessionState.AWAITING_MANUAL_RESPONSE, messageId);
    }

    public static OperatorSession awaitingEditFeedback(String responseId) {
        return new OperatorSession(SessionState.AWAITING_EDIT_FEEDBACK, responseId);
    }

    public boolean isIdle() {
        return state == SessionState.IDLE;
    }
}
