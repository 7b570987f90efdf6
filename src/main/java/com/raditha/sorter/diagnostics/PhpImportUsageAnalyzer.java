package com.raditha.sorter.diagnostics;

import com.raditha.sorter.syntax.Capture;
import com.raditha.sorter.syntax.LineIndex;
import com.raditha.sorter.syntax.NodeQuery;
import com.raditha.sorter.syntax.NodeRange;
import com.raditha.sorter.syntax.SyntaxException;
import com.raditha.sorter.syntax.SyntaxNode;
import com.raditha.sorter.syntax.SyntaxTree;
import com.raditha.sorter.syntax.php.PhpNameScanner;
import com.raditha.sorter.syntax.php.PhpSyntaxTreeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds PHP namespace imports whose alias never appears in the file.
 * <p>
 * Class and function aliases match case-insensitively, constant aliases exactly. A statement
 * importing several names is reported only when none of them is used.
 */
public class PhpImportUsageAnalyzer implements ImportUsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PhpImportUsageAnalyzer.class);

    private final PhpSyntaxTreeProvider provider = new PhpSyntaxTreeProvider();

    /**
     * A name brought into scope by a use statement.
     *
     * @param name     imported name as written
     * @param alias    local alias
     * @param constant whether it was imported with {@code use const}
     */
    record ImportedName(String name, String alias, boolean constant) {
    }

    @Override
    public List<Diagnostic> findUnusedImports(String source) {
        SyntaxTree tree;
        try {
            tree = provider.parse(source);
        } catch (SyntaxException e) {
            logger.warn("Cannot analyze imports: {}", e.getMessage());
            return List.of();
        }
        LineIndex index = new LineIndex(source);
        List<int[]> importSpans = new ArrayList<>();
        List<Capture> imports = tree.captures(NodeQuery.NAMESPACE_USES);
        for (Capture capture : imports) {
            NodeRange range = capture.node().range();
            importSpans.add(new int[] {
                    index.offsetOf(range.startRow(), range.startColumn()),
                    index.offsetOf(range.endRow(), range.endColumn())});
        }

        Set<String> used = new HashSet<>();
        Set<String> usedExact = new HashSet<>();
        for (PhpNameScanner.NameOccurrence occurrence : PhpNameScanner.scan(source)) {
            if (insideAny(occurrence.offset(), importSpans) || occurrence.name().startsWith("\\")) {
                continue;
            }
            String first = occurrence.name().split("\\\\", 2)[0];
            used.add(first.toLowerCase(Locale.ROOT));
            usedExact.add(first);
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Capture capture : imports) {
            SyntaxNode node = capture.node();
            List<ImportedName> names = parseUseStatement(node.text());
            if (names.isEmpty()) {
                continue;
            }
            boolean anyUsed = names.stream().anyMatch(n -> n.constant()
                    ? usedExact.contains(n.alias())
                    : used.contains(n.alias().toLowerCase(Locale.ROOT)));
            if (!anyUsed) {
                String symbols = String.join(", ", names.stream().map(ImportedName::name).toList());
                diagnostics.add(new Diagnostic(node.range().startRow() + 1,
                        "Symbol '" + symbols + "' is declared but not used."));
            }
        }
        return diagnostics;
    }

    /**
     * Names imported by one statement, e.g. {@code use A\B as C, D;} or
     * {@code use function A\{b, c as d};}.
     */
    static List<ImportedName> parseUseStatement(String statement) {
        String body = statement.trim();
        if (body.regionMatches(true, 0, "use", 0, 3)) {
            body = body.substring(3);
        }
        body = stripTrailing(body.trim(), ';');
        String kind = leadingKind(body);
        if (!kind.isEmpty()) {
            body = body.substring(kind.length()).trim();
        }

        List<ImportedName> names = new ArrayList<>();
        int brace = body.indexOf('{');
        if (brace >= 0) {
            String prefix = body.substring(0, brace).trim();
            String inner = stripTrailing(body.substring(brace + 1).trim(), '}');
            for (String clause : inner.split(",")) {
                addClause(names, prefix, clause, kind);
            }
        } else {
            for (String clause : body.split(",")) {
                addClause(names, "", clause, kind);
            }
        }
        return names;
    }

    private static void addClause(List<ImportedName> names, String prefix, String clause, String statementKind) {
        String item = clause.trim();
        if (item.isEmpty()) {
            return;
        }
        String kind = leadingKind(item);
        if (!kind.isEmpty()) {
            item = item.substring(kind.length()).trim();
        } else {
            kind = statementKind;
        }
        String name = item;
        String alias = null;
        String[] parts = item.split("(?i)\\s+as\\s+");
        if (parts.length == 2) {
            name = parts[0].trim();
            alias = parts[1].trim();
        }
        String qualified = (prefix + name).replaceAll("\\s+", "");
        if (qualified.startsWith("\\")) {
            qualified = qualified.substring(1);
        }
        if (alias == null) {
            alias = qualified.substring(qualified.lastIndexOf('\\') + 1);
        }
        names.add(new ImportedName(qualified, alias, "const".equals(kind)));
    }

    private static String leadingKind(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String kind : new String[] {"function", "const"}) {
            if (lower.startsWith(kind) && text.length() > kind.length()
                    && Character.isWhitespace(text.charAt(kind.length()))) {
                return kind;
            }
        }
        return "";
    }

    private static String stripTrailing(String text, char c) {
        return !text.isEmpty() && text.charAt(text.length() - 1) == c
                ? text.substring(0, text.length() - 1).trim()
                : text;
    }

    private static boolean insideAny(int offset, List<int[]> spans) {
        for (int[] span : spans) {
            if (offset >= span[0] && offset < span[1]) {
                return true;
            }
        }
        return false;
    }
}
