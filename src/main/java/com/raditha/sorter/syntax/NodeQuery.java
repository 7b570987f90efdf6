package com.raditha.sorter.syntax;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Selects nodes by type and names the captures they produce.
 *
 * @param captureNames capture name for each selected node type
 */
public record NodeQuery(Map<String, String> captureNames) {

    /**
     * Class-like scopes whose bodies are sorted independently.
     */
    public static final NodeQuery SCOPES = builder()
            .capture(NodeTypes.CLASS_DECLARATION, "class")
            .capture(NodeTypes.TRAIT_DECLARATION, "class")
            .build();

    /**
     * Declarations sorted inside a scope.
     */
    public static final NodeQuery SCOPE_DECLARATIONS = builder()
            .capture(NodeTypes.USE_DECLARATION, "trait")
            .capture(NodeTypes.CONST_DECLARATION, "const")
            .capture(NodeTypes.PROPERTY_DECLARATION, "property")
            .build();

    public static final NodeQuery NAMESPACE_USES = builder()
            .capture(NodeTypes.NAMESPACE_USE_DECLARATION, "namespace_use_declaration")
            .build();

    public NodeQuery {
        captureNames = Map.copyOf(captureNames);
    }

    /**
     * Capture name for a node type, or null when the type is not selected.
     */
    public String captureName(String nodeType) {
        return captureNames.get(nodeType);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> captures = new LinkedHashMap<>();

        public Builder capture(String nodeType, String captureName) {
            captures.put(nodeType, captureName);
            return this;
        }

        public NodeQuery build() {
            return new NodeQuery(captures);
        }
    }
}
