package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.service.PlatformConnector;

public record ConnectorSelection(
        String platform,
        PlatformConnector connector,
        ConnectorVariant variant,
        String substitutionReason
) {
}
