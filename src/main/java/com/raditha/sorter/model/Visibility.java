package com.raditha.sorter.model;

import java.util.Locale;

/**
 * Access modifiers ordered by sort precedence: private first, public last.
 */
public enum Visibility {
    PRIVATE(1),
    PROTECTED(2),
    PUBLIC(3);

    private final int rank;

    Visibility(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Keyword as written in source.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a visibility keyword (case-insensitive).
     *
     * @param value the keyword
     * @return the corresponding Visibility
     * @throws IllegalArgumentException if the value is not public, protected or private
     */
    public static Visibility fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Visibility value cannot be null");
        }

        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "private" -> PRIVATE;
            case "protected" -> PROTECTED;
            case "public" -> PUBLIC;
            default -> throw new IllegalArgumentException(
                    "Invalid visibility: " + value + ". Must be: public, protected, or private");
        };
    }
}
