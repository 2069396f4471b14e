package com.abba.answerdesk.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Platform {
    LINKEDIN("linkedin"),
    GMAIL("gmail"),
    TELEGRAM("telegram"),
    FACEBOOK("facebook"),
    INSTAGRAM("instagram");

    private final String key;

    Platform(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1);
    }

    public static Optional<Platform> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(platform -> platform.key.equals(normalized))
                .findFirst();
    }
}
