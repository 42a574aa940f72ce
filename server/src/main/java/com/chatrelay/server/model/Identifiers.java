package com.chatrelay.server.model;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

public final class Identifiers {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    private Identifiers() {
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    public static boolean allUuids(Collection<String> values) {
        for (String v : values) {
            if (!isUuid(v)) return false;
        }
        return true;
    }

    /** Lower-cases an id so the same entity always maps to the same room name. */
    public static String normalize(String uuid) {
        return uuid.toLowerCase(Locale.ROOT);
    }
}
