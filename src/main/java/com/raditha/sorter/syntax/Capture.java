package com.raditha.sorter.syntax;

/**
 * One node matched by a {@link NodeQuery}.
 *
 * @param name capture name assigned by the query
 * @param node matched node
 */
public record Capture(String name, SyntaxNode node) {
}
