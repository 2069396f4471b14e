package com.abba.answerdesk.application.connector;

public enum ConnectorVariant {
    REAL,
    SIMULATED
}
