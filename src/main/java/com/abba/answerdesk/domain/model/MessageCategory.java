package com.abba.answerdesk.domain.model;

import java.util.Locale;

public enum MessageCategory {
    BUSINESS,
    PERSONAL,
    SUPPORT,
    NETWORKING,
    SALES,
    GENERAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
