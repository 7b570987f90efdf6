package com.raditha.sorter.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SyntaxTree} over {@link SourceNode}s; captures are collected by a pre-order walk.
 */
public class SourceTree implements SyntaxTree {

    private final SyntaxNode root;
    private final Language language;

    public SourceTree(SyntaxNode root, Language language) {
        this.root = root;
        this.language = language;
    }

    @Override
    public SyntaxNode root() {
        return root;
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public List<Capture> captures(NodeQuery query, int startRow, int endRow) {
        List<Capture> captures = new ArrayList<>();
        collect(root, query, startRow, endRow, captures);
        return captures;
    }

    private static void collect(SyntaxNode node, NodeQuery query, int startRow, int endRow, List<Capture> out) {
        if (!node.range().intersectsRows(startRow, endRow)) {
            return;
        }
        String name = query.captureName(node.type());
        if (name != null) {
            out.add(new Capture(name, node));
        }
        for (SyntaxNode child : node.children()) {
            collect(child, query, startRow, endRow, out);
        }
    }
}
