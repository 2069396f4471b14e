package com.abba.answerdesk.domain.exception;

public class TransientProviderException extends ConnectorException {

    public TransientProviderException(String platform, String message) {
        super(platform, message);
    }

    public TransientProviderException(String platform, String message, Throwable cause) {
        super(platform, message, cause);
    }
}
