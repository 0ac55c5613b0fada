package com.vidnyan.doclint.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Externally authored evaluation criterion.
 * The criteria text is fed to the oracle verbatim; the engine never interprets it.
 */
public record Rule(
    String id,
    Severity severity,
    String criteria
) {

    public Rule {
        Objects.requireNonNull(id, "id");
        severity = severity != null ? severity : Severity.ERROR;
        criteria = criteria != null ? criteria : "";
    }

    public enum Severity {
        ERROR,      // Fails the run
        WARN;       // Reported, caller decides whether it blocks

        /**
         * Lenient mapping used by rule sources; anything that is not a warning is an error.
         */
        public static Severity parse(String value) {
            if (value == null) return ERROR;
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "warn", "warning" -> WARN;
                default -> ERROR;
            };
        }
    }
}
