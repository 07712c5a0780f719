package com.phillippitts.scriptorium.domain;

import java.util.Locale;
import java.util.Optional;

public enum ReviewAction {
    ACCEPT,
    REJECT;

    /**
     * Parses the wire value ("accept" / "reject"), case-insensitively.
     *
     * @return the action, or empty for null or unrecognised values
     */
    public static Optional<ReviewAction> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "accept" -> Optional.of(ACCEPT);
            case "reject" -> Optional.of(REJECT);
            default -> Optional.empty();
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
