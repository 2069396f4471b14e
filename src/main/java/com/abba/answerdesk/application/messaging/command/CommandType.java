package com.abba.answerdesk.application.messaging.command;

public enum CommandType {
    HELP,
    NEXT,
    GENERATE,
    IGNORE,
    MANUAL,
    EDIT,
    SEND,
    TEXT;

    public boolean isTargeted() {
        return this == GENERATE || this == IGNORE || this == MANUAL || this == EDIT || this == SEND;
    }
}
