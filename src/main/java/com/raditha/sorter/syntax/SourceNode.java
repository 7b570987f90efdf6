package com.raditha.sorter.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} built by the bundled providers.
 */
public class SourceNode implements SyntaxNode {

    private final String type;
    private final NodeRange range;
    private final String text;
    private final List<SyntaxNode> children = new ArrayList<>();
    private SourceNode parent;
    private int indexInParent = -1;

    public SourceNode(String type, NodeRange range, String text) {
        this.type = type;
        this.range = range;
        this.text = text;
    }

    /**
     * Append a child; children must be added in document order.
     */
    public SourceNode addChild(SourceNode child) {
        child.parent = this;
        child.indexInParent = children.size();
        children.add(child);
        return child;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public NodeRange range() {
        return range;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public Optional<SyntaxNode> prevSibling() {
        if (parent == null || indexInParent <= 0) {
            return Optional.empty();
        }
        return Optional.of(parent.children.get(indexInParent - 1));
    }

    @Override
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return type + "[" + (range.startRow() + 1) + "-" + (range.endRow() + 1) + "]";
    }
}
