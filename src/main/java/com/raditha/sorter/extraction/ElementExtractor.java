package com.raditha.sorter.extraction;

import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Comment;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.MissingParserException;
import com.raditha.sorter.model.Range;
import com.raditha.sorter.syntax.Capture;
import com.raditha.sorter.syntax.NodeQuery;
import com.raditha.sorter.syntax.NodeRange;
import com.raditha.sorter.syntax.NodeTypes;
import com.raditha.sorter.syntax.SyntaxNode;
import com.raditha.sorter.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns syntax tree captures into typed {@link Element}s.
 * <p>
 * Only statements that own their lines are extracted: a declaration sharing a line with
 * other code (apart from a trailing comment) cannot be moved line-wise and is left alone.
 */
public class ElementExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ElementExtractor.class);

    /**
     * Extract trait uses, constants and properties from a scope.
     *
     * @param tree     parsed buffer
     * @param buffer   buffer the tree was parsed from
     * @param startRow first row of the scope (0-based)
     * @param endRow   last row of the scope (0-based), or -1 for the whole file
     * @throws MissingParserException if there is no tree
     */
    public ScopeElements extract(SyntaxTree tree, LineBuffer buffer, int startRow, int endRow) {
        requireTree(tree);
        List<String> lines = buffer.lines();
        List<NodeRange> nested = nestedScopes(tree, startRow, endRow);

        List<Element> traits = new ArrayList<>();
        List<Element> constants = new ArrayList<>();
        List<Element> properties = new ArrayList<>();
        for (Capture capture : tree.captures(NodeQuery.SCOPE_DECLARATIONS, startRow, endRow)) {
            SyntaxNode node = capture.node();
            if (!inWindow(node, startRow, endRow) || insideAny(node, nested)) {
                continue;
            }
            Category category = Category.fromNodeType(node.type());
            toElement(node, category, lines).ifPresent(element -> {
                switch (category) {
                    case TRAIT_USE -> traits.add(element);
                    case CONSTANT -> constants.add(element);
                    default -> properties.add(element);
                }
            });
        }
        logger.debug("Extracted {} traits, {} constants, {} properties from rows {}..{}",
                traits.size(), constants.size(), properties.size(), startRow, endRow);
        return new ScopeElements(traits, constants, properties);
    }

    /**
     * Extract every namespace import of the file.
     *
     * @throws MissingParserException if there is no tree
     */
    public List<Element> extractImports(SyntaxTree tree, LineBuffer buffer) {
        requireTree(tree);
        List<String> lines = buffer.lines();
        List<Element> imports = new ArrayList<>();
        for (Capture capture : tree.captures(NodeQuery.NAMESPACE_USES)) {
            toElement(capture.node(), Category.IMPORT_USE, lines).ifPresent(imports::add);
        }
        return imports;
    }

    /**
     * A node is taken when it starts inside the window. For an open-ended window the end is
     * one row past the node's own start, so every node qualifies.
     */
    static boolean inWindow(SyntaxNode node, int startRow, int endRow) {
        int nodeStart = node.range().startRow();
        int effectiveEnd = endRow == -1 ? nodeStart + 1 : endRow;
        return startRow <= nodeStart && nodeStart <= effectiveEnd;
    }

    private Optional<Element> toElement(SyntaxNode node, Category category, List<String> lines) {
        NodeRange range = node.range();
        if (range.endRow() >= lines.size() || !ownsLines(range, lines)) {
            logger.debug("Skipping {} at row {}: shares its lines with other code", node.type(), range.startRow());
            return Optional.empty();
        }
        Comment comment = attachedComment(node, lines);
        String visibility = node.childText(NodeTypes.VISIBILITY_MODIFIER).orElse(null);
        return Optional.of(new Element(
                category,
                Range.fromRows(range.startRow(), range.endRow()),
                lines.subList(range.startRow(), range.endRow() + 1),
                node.text(),
                comment,
                visibility));
    }

    /**
     * The comment directly preceding the node, provided it stands on its own lines and
     * does not trail an earlier statement.
     */
    private Comment attachedComment(SyntaxNode node, List<String> lines) {
        Optional<SyntaxNode> previous = node.prevSibling();
        if (previous.isEmpty() || !previous.get().isComment()) {
            return null;
        }
        SyntaxNode comment = previous.get();
        NodeRange range = comment.range();
        if (range.endRow() >= node.range().startRow() || !blankBefore(range, lines)) {
            return null;
        }
        Optional<SyntaxNode> beforeComment = comment.prevSibling();
        if (beforeComment.isPresent() && beforeComment.get().range().endRow() >= range.startRow()) {
            return null;
        }
        return new Comment(
                Range.fromRows(range.startRow(), range.endRow()),
                lines.subList(range.startRow(), range.endRow() + 1));
    }

    private static boolean ownsLines(NodeRange range, List<String> lines) {
        if (!blankBefore(range, lines)) {
            return false;
        }
        String last = lines.get(range.endRow());
        String rest = range.endColumn() >= last.length() ? "" : last.substring(range.endColumn()).trim();
        return rest.isEmpty() || rest.startsWith("//") || rest.startsWith("#") || rest.startsWith("/*");
    }

    private static boolean blankBefore(NodeRange range, List<String> lines) {
        String first = lines.get(range.startRow());
        return first.substring(0, Math.min(range.startColumn(), first.length())).isBlank();
    }

    /**
     * Class bodies nested strictly inside the window; their members belong to their own scope.
     */
    private static List<NodeRange> nestedScopes(SyntaxTree tree, int startRow, int endRow) {
        List<NodeRange> nested = new ArrayList<>();
        if (endRow == -1) {
            return nested;
        }
        for (Capture capture : tree.captures(NodeQuery.SCOPES, startRow, endRow)) {
            NodeRange range = capture.node().range();
            if (range.startRow() > startRow && range.endRow() <= endRow) {
                nested.add(range);
            }
        }
        return nested;
    }

    private static boolean insideAny(SyntaxNode node, List<NodeRange> scopes) {
        int row = node.range().startRow();
        for (NodeRange scope : scopes) {
            if (row >= scope.startRow() && row <= scope.endRow()) {
                return true;
            }
        }
        return false;
    }

    private static void requireTree(SyntaxTree tree) {
        if (tree == null) {
            throw new MissingParserException("No syntax tree available for extraction");
        }
    }
}
