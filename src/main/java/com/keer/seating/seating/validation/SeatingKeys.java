package com.keer.seating.seating.validation;

import java.util.Locale;

/**
 * Normalization shared by table label matching and guest natural keys.
 */
public final class SeatingKeys {

    private SeatingKeys() {}

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String tableKey(String label) {
        return normalize(label);
    }

    public static String naturalKey(String name, String contact) {
        return normalize(name) + "|" + normalize(contact);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
