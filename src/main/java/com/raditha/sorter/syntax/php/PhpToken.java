package com.raditha.sorter.syntax.php;

/**
 * Lexical token of a PHP source file.
 *
 * @param kind  token class
 * @param text  token text
 * @param start offset of the first character
 * @param end   offset after the last character
 */
record PhpToken(Kind kind, String text, int start, int end) {

    enum Kind {
        WORD,
        VARIABLE,
        STRING,
        COMMENT,
        ATTRIBUTE_START,
        PUNCT,
        OPEN_TAG,
        CLOSE_TAG,
        INLINE_HTML
    }

    boolean is(Kind expected) {
        return kind == expected;
    }

    boolean isPunct(String value) {
        return kind == Kind.PUNCT && text.equals(value);
    }

    boolean isWord(String value) {
        return kind == Kind.WORD && text.equalsIgnoreCase(value);
    }

    /**
     * Opens a nesting level: ( [ { or #[.
     */
    boolean opens() {
        return kind == Kind.ATTRIBUTE_START
                || (kind == Kind.PUNCT && (text.equals("(") || text.equals("[") || text.equals("{")));
    }

    boolean closes() {
        return kind == Kind.PUNCT && (text.equals(")") || text.equals("]") || text.equals("}"));
    }
}
