package com.example.compliance.model;

import java.util.Locale;
import java.util.Map;

/**
 * Defect severity, most severe first so that {@link #ordinal()} sorts naturally.
 */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, UNKNOWN;

    /** Labels the model uses besides the enum names, including the Russian ones of the gateway's default locale. */
    private static final Map<String, Severity> ALIASES = Map.ofEntries(
            Map.entry("blocker", CRITICAL),
            Map.entry("критическая", CRITICAL),
            Map.entry("major", HIGH),
            Map.entry("высокая", HIGH),
            Map.entry("moderate", MEDIUM),
            Map.entry("средняя", MEDIUM),
            Map.entry("minor", LOW),
            Map.entry("низкая", LOW)
    );

    public static Severity fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        Severity alias = ALIASES.get(key);
        if (alias != null) {
            return alias;
        }
        try {
            return Severity.valueOf(key.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }
}
