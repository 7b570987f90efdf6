package com.raditha.sorter.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Opaque handle on a node of a parsed source file.
 */
public interface SyntaxNode {

    /**
     * Node kind, e.g. {@code property_declaration} or {@code comment}.
     */
    String type();

    NodeRange range();

    /**
     * Exact source text of the node.
     */
    String text();

    Optional<SyntaxNode> prevSibling();

    List<SyntaxNode> children();

    default boolean isComment() {
        return NodeTypes.COMMENT.equals(type());
    }

    /**
     * Text of the first direct child of the given type.
     */
    default Optional<String> childText(String childType) {
        for (SyntaxNode child : children()) {
            if (childType.equals(child.type())) {
                return Optional.of(child.text());
            }
        }
        return Optional.empty();
    }
}
