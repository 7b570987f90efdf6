package com.raditha.sorter.syntax.php;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits PHP source into the tokens the statement scanner needs.
 * <p>
 * Only what decides statement boundaries is recognised: names, variables, strings
 * (heredoc and nowdoc included), comments, attributes, open/close tags and single-character
 * punctuation. Operators are left as runs of punctuation.
 */
class PhpLexer {

    private final String src;
    private int pos;
    private final List<PhpToken> tokens = new ArrayList<>();

    PhpLexer(String src) {
        this.src = src;
    }

    List<PhpToken> tokenize() {
        pos = 0;
        tokens.clear();
        lexInlineHtml();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (startsWith("?>")) {
                add(PhpToken.Kind.CLOSE_TAG, pos, pos + 2);
                lexInlineHtml();
            } else if (startsWith("//") || (c == '#' && !startsWith("#["))) {
                lexLineComment();
            } else if (startsWith("/*")) {
                int close = src.indexOf("*/", pos + 2);
                add(PhpToken.Kind.COMMENT, pos, close < 0 ? src.length() : close + 2);
            } else if (startsWith("#[")) {
                add(PhpToken.Kind.ATTRIBUTE_START, pos, pos + 2);
            } else if (c == '\'' || c == '"' || c == '`') {
                lexQuoted(c);
            } else if (startsWith("<<<")) {
                lexHeredoc();
            } else if (c == '$' && pos + 1 < src.length() && isNameStart(src.charAt(pos + 1))) {
                int end = scanName(pos + 1);
                add(PhpToken.Kind.VARIABLE, pos, end);
            } else if (isNameStart(c) || c == '\\' || Character.isDigit(c)) {
                add(PhpToken.Kind.WORD, pos, scanName(pos));
            } else {
                add(PhpToken.Kind.PUNCT, pos, pos + 1);
            }
        }
        return tokens;
    }

    private void lexInlineHtml() {
        int open = src.indexOf("<?", pos);
        if (open < 0) {
            if (pos < src.length()) {
                add(PhpToken.Kind.INLINE_HTML, pos, src.length());
            }
            pos = src.length();
            return;
        }
        if (open > pos) {
            add(PhpToken.Kind.INLINE_HTML, pos, open);
        }
        int end = open + 2;
        if (src.startsWith("php", end)) {
            end += 3;
        } else if (src.startsWith("=", end)) {
            end += 1;
        }
        add(PhpToken.Kind.OPEN_TAG, open, end);
    }

    private void lexLineComment() {
        int end = pos;
        while (end < src.length() && src.charAt(end) != '\n' && !src.startsWith("?>", end)) {
            end++;
        }
        int trimmed = end;
        while (trimmed > pos && src.charAt(trimmed - 1) == '\r') {
            trimmed--;
        }
        tokens.add(new PhpToken(PhpToken.Kind.COMMENT, src.substring(pos, trimmed), pos, trimmed));
        pos = end;
    }

    private void lexQuoted(char quote) {
        int end = pos + 1;
        while (end < src.length()) {
            char c = src.charAt(end);
            if (c == '\\') {
                end += 2;
                continue;
            }
            end++;
            if (c == quote) {
                break;
            }
        }
        add(PhpToken.Kind.STRING, pos, Math.min(end, src.length()));
    }

    private void lexHeredoc() {
        int cursor = pos + 3;
        while (cursor < src.length() && (src.charAt(cursor) == ' ' || src.charAt(cursor) == '\t')) {
            cursor++;
        }
        boolean quoted = cursor < src.length() && (src.charAt(cursor) == '\'' || src.charAt(cursor) == '"');
        if (quoted) {
            cursor++;
        }
        int labelEnd = scanName(cursor);
        if (labelEnd == cursor) {
            add(PhpToken.Kind.PUNCT, pos, pos + 1);
            return;
        }
        String label = src.substring(cursor, labelEnd);
        int lineStart = src.indexOf('\n', labelEnd);
        while (lineStart >= 0) {
            int bodyStart = lineStart + 1;
            int content = bodyStart;
            while (content < src.length() && (src.charAt(content) == ' ' || src.charAt(content) == '\t')) {
                content++;
            }
            if (src.startsWith(label, content)) {
                int after = content + label.length();
                if (after >= src.length() || !isNameChar(src.charAt(after))) {
                    add(PhpToken.Kind.STRING, pos, after);
                    return;
                }
            }
            lineStart = src.indexOf('\n', bodyStart);
        }
        add(PhpToken.Kind.STRING, pos, src.length());
    }

    private int scanName(int from) {
        int end = from;
        while (end < src.length() && (isNameChar(src.charAt(end)) || src.charAt(end) == '\\')) {
            end++;
        }
        return end;
    }

    private boolean startsWith(String prefix) {
        return src.startsWith(prefix, pos);
    }

    private void add(PhpToken.Kind kind, int start, int end) {
        tokens.add(new PhpToken(kind, src.substring(start, end), start, end));
        pos = end;
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_' || c >= 0x80;
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || Character.isDigit(c);
    }
}
