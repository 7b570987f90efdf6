package com.raditha.sorter.syntax.php;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the names a PHP source refers to, for usage analysis.
 * <p>
 * Names in code are taken from the token stream, so strings and ordinary comments never
 * count. Type names inside docblocks ({@code @var Foo}, {@code @param Foo|null $x}) do count.
 */
public final class PhpNameScanner {

    private static final Pattern DOC_TAG = Pattern.compile(
            "@(?:var|param|return|throws|property(?:-read|-write)?|method|mixin|extends|implements|template|see)"
                    + "\\b([^\\n*]*)");
    private static final Pattern DOC_NAME = Pattern.compile("\\\\?[A-Za-z_][A-Za-z0-9_]*(?:\\\\[A-Za-z_][A-Za-z0-9_]*)*");

    /**
     * @param name   name as written, possibly qualified ({@code Foo\Bar}, {@code \Foo})
     * @param offset character offset of the name in the source
     */
    public record NameOccurrence(String name, int offset) {
    }

    private PhpNameScanner() {
    }

    public static List<NameOccurrence> scan(String source) {
        List<NameOccurrence> names = new ArrayList<>();
        for (PhpToken token : new PhpLexer(source).tokenize()) {
            if (token.is(PhpToken.Kind.WORD) && !Character.isDigit(token.text().charAt(0))) {
                names.add(new NameOccurrence(token.text(), token.start()));
            } else if (token.is(PhpToken.Kind.COMMENT) && token.text().startsWith("/**")) {
                scanDocblock(token, names);
            }
        }
        return names;
    }

    private static void scanDocblock(PhpToken token, List<NameOccurrence> names) {
        Matcher tag = DOC_TAG.matcher(token.text());
        while (tag.find()) {
            Matcher name = DOC_NAME.matcher(tag.group(1));
            while (name.find()) {
                names.add(new NameOccurrence(name.group(), token.start() + tag.start(1) + name.start()));
            }
        }
    }
}
