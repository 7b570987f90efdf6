package com.raditha.sorter.syntax;

/**
 * Node type names shared by every syntax tree provider.
 */
public final class NodeTypes {

    public static final String PROGRAM = "program";
    public static final String COMMENT = "comment";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String TRAIT_DECLARATION = "trait_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String NAMESPACE_USE_DECLARATION = "namespace_use_declaration";
    public static final String USE_DECLARATION = "use_declaration";
    public static final String CONST_DECLARATION = "const_declaration";
    public static final String PROPERTY_DECLARATION = "property_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String VISIBILITY_MODIFIER = "visibility_modifier";
    public static final String STATIC_MODIFIER = "static_modifier";
    public static final String READONLY_MODIFIER = "readonly_modifier";
    public static final String FINAL_MODIFIER = "final_modifier";
    public static final String ABSTRACT_MODIFIER = "abstract_modifier";
    public static final String VAR_MODIFIER = "var_modifier";
    public static final String MODIFIER = "modifier";
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String STATEMENT = "statement";
    public static final String MEMBER = "member";

    private NodeTypes() {
    }
}
