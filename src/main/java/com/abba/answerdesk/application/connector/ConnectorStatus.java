package com.abba.answerdesk.application.connector;

public record ConnectorStatus(
        String platform,
        ConnectorVariant variant,
        boolean connected,
        String lastError,
        long requestCount,
        String substitutionReason
) {
}
