package com.abba.answerdesk.domain.model;

public enum ResponseType {
    GENERATED,
    MANUAL
}
