package com.abba.answerdesk.application.messaging.conversation;

public enum SessionState {
    IDLE,
    AWAITING_MANUAL_RESPONSE,
    AWAITING_EDIT_FEEDBACK
}
