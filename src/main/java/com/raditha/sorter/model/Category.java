package com.raditha.sorter.model;

/**
 * Kinds of declarations the sorter reorders.
 */
public enum Category {
    /**
     * Namespace import at module scope ({@code use Foo\Bar;}).
     */
    IMPORT_USE("namespace_use_declaration"),

    /**
     * Trait use inside a class body ({@code use LoggerTrait;}).
     */
    TRAIT_USE("use_declaration"),

    CONSTANT("const_declaration"),

    PROPERTY("property_declaration");

    private final String nodeType;

    Category(String nodeType) {
        this.nodeType = nodeType;
    }

    /**
     * Syntax node type that declarations of this category carry.
     */
    public String nodeType() {
        return nodeType;
    }

    /**
     * Resolve a category from a syntax node type.
     *
     * @return the category, or null when the node type is not sortable
     */
    public static Category fromNodeType(String nodeType) {
        for (Category category : values()) {
            if (category.nodeType.equals(nodeType)) {
                return category;
            }
        }
        return null;
    }
}
