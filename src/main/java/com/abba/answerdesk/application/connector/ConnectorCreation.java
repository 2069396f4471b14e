package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.service.PlatformConnector;

public record ConnectorCreation(PlatformConnector connector, String failureReason) {

    public static ConnectorCreation created(PlatformConnector connector) {
        return new ConnectorCreation(connector, null);
    }

    public static ConnectorCreation failed(String reason) {
        return new ConnectorCreation(null, reason);
    }

    public boolean isCreated() {
        return connector != null;
    }
}
