package com.abba.answerdesk.application.messaging.command;

import java.util.Locale;
import java.util.Map;

public record OperatorCommand(CommandType type, String argument) {

    private static final Map<String, CommandType> TARGETED = Map.of(
            "generate", CommandType.GENERATE,
            "ignore", CommandType.IGNORE,
            "manual", CommandType.MANUAL,
            "edit", CommandType.EDIT,
            "send", CommandType.SEND);

    public static OperatorCommand parse(String input) {
        String raw = input == null ? "" : input.trim();
        String candidate = raw.startsWith("/") ? raw.substring(1) : raw;
        String lower = candidate.toLowerCase(Locale.ROOT);

        if (lower.equals("next")) {
            return new OperatorCommand(CommandType.NEXT, null);
        }
        if (lower.equals("start") || lower.equals("help")) {
            return new OperatorCommand(CommandType.HELP, null);
        }

        int separator = candidate.indexOf(':');
        if (separator > 0) {
            CommandType type = TARGETED.get(lower.substring(0, separator));
            String target = candidate.substring(separator + 1).trim();
            if (type != null && !target.isEmpty() && !target.contains(" ")) {
                return new OperatorCommand(type, target);
            }
        }
        return new OperatorCommand(CommandType.TEXT, raw);
    }

    public static String format(CommandType type, String target) {
        return type.name().toLowerCase(Locale.ROOT) + ":" + target;
    }
}
