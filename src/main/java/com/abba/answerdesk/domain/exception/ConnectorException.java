package com.abba.answerdesk.domain.exception;

import lombok.Getter;

@Getter
public class ConnectorException extends RuntimeException {

    private final String platform;

    public ConnectorException(String platform, String message) {
        super(message);
        this.platform = platform;
    }

    public ConnectorException(String platform, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
    }
}
