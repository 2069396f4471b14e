package com.abba.answerdesk.domain.exception;

public class AuthenticationException extends ConnectorException {

    public AuthenticationException(String platform, String message) {
        super(platform, message);
    }
}
