package com.raditha.sorter.syntax;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Source languages a buffer can declare.
 */
public enum Language {
    PHP("php", ".php"),
    JAVA("java", ".java");

    private final String tag;
    private final String extension;

    Language(String tag, String extension) {
        this.tag = tag;
        this.extension = extension;
    }

    public String tag() {
        return tag;
    }

    /**
     * Convert a language tag (case-insensitive) to a Language.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static Language fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Language value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.tag.equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Invalid language: " + value + ". Must be: php or java");
    }

    /**
     * Language declared by a file's extension.
     *
     * @throws IllegalArgumentException if the extension is not recognised
     */
    public static Language fromPath(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (name.endsWith(language.extension)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Cannot determine language of " + file);
    }
}
