package com.raditha.sorter.syntax.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.syntax.LineIndex;
import com.raditha.sorter.syntax.NodeTypes;
import com.raditha.sorter.syntax.SourceNode;
import com.raditha.sorter.syntax.SourceTree;
import com.raditha.sorter.syntax.SyntaxException;
import com.raditha.sorter.syntax.SyntaxTree;
import com.raditha.sorter.syntax.SyntaxTreeProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Adapts JavaParser compilation units to the shared syntax tree.
 * <p>
 * Imports become namespace uses, {@code static final} fields constants and the remaining
 * fields properties. Classes, enums and records are sortable scopes; interfaces are not, their
 * fields being implicitly constant.
 */
public class JavaSyntaxTreeProvider implements SyntaxTreeProvider {

    private final JavaParser parser;

    public JavaSyntaxTreeProvider() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(true);
        this.parser = new JavaParser(configuration);
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public SyntaxTree parse(String text) {
        ParseResult<CompilationUnit> result = parser.parse(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SyntaxException("Cannot parse Java source: " + result.getProblems());
        }
        CompilationUnit cu = result.getResult().get();
        LineIndex index = new LineIndex(text);

        SourceNode root = new SourceNode(NodeTypes.PROGRAM, index.rangeOf(0, text.length()), text);
        List<Node> items = new ArrayList<>();
        cu.getPackageDeclaration().ifPresent(items::add);
        items.addAll(cu.getImports());
        items.addAll(cu.getTypes());
        addChildren(root, items, cu.getOrphanComments(), index);
        return new SourceTree(root, Language.JAVA);
    }

    private void addChildren(SourceNode parent, List<? extends Node> items, List<Comment> orphans, LineIndex index) {
        List<Node> siblings = new ArrayList<>(orphans);
        for (Node item : items) {
            item.getComment().ifPresent(siblings::add);
            siblings.add(item);
        }
        siblings.removeIf(n -> n.getRange().isEmpty());
        siblings.sort(Comparator.comparing((Node n) -> n.getRange().get().begin));

        for (Node sibling : siblings) {
            SourceNode child = parent.addChild(toSourceNode(sibling, index));
            if (sibling instanceof TypeDeclaration<?> type) {
                List<Node> members = new ArrayList<>();
                if (type instanceof EnumDeclaration enumDeclaration) {
                    members.addAll(enumDeclaration.getEntries());
                }
                members.addAll(type.getMembers());
                addChildren(child, members, type.getOrphanComments(), index);
            } else if (sibling instanceof FieldDeclaration field) {
                addModifiers(child, field, index);
            }
        }
    }

    private void addModifiers(SourceNode parent, FieldDeclaration field, LineIndex index) {
        for (Modifier modifier : field.getModifiers()) {
            if (modifier.getRange().isPresent()) {
                parent.addChild(toSourceNode(modifier, modifierType(modifier.getKeyword()), index));
            }
        }
    }

    private SourceNode toSourceNode(Node node, LineIndex index) {
        return toSourceNode(node, typeOf(node), index);
    }

    private SourceNode toSourceNode(Node node, String type, LineIndex index) {
        com.github.javaparser.Range range = node.getRange().orElseThrow();
        int start = index.offsetOf(range.begin.line - 1, range.begin.column - 1);
        int end = index.offsetOf(range.end.line - 1, range.end.column - 1) + 1;
        end = Math.max(start, end);
        return new SourceNode(type, index.rangeOf(start, end), index.slice(start, end));
    }

    static String typeOf(Node node) {
        if (node instanceof Comment) {
            return NodeTypes.COMMENT;
        }
        if (node instanceof com.github.javaparser.ast.ImportDeclaration) {
            return NodeTypes.NAMESPACE_USE_DECLARATION;
        }
        if (node instanceof ClassOrInterfaceDeclaration type) {
            return type.isInterface() ? NodeTypes.INTERFACE_DECLARATION : NodeTypes.CLASS_DECLARATION;
        }
        if (node instanceof EnumDeclaration || node instanceof RecordDeclaration) {
            return NodeTypes.CLASS_DECLARATION;
        }
        if (node instanceof TypeDeclaration<?>) {
            return NodeTypes.INTERFACE_DECLARATION;
        }
        if (node instanceof FieldDeclaration field) {
            return (field.isStatic() && field.isFinal()) || inInterface(field)
                    ? NodeTypes.CONST_DECLARATION
                    : NodeTypes.PROPERTY_DECLARATION;
        }
        if (node instanceof CallableDeclaration<?>) {
            return NodeTypes.METHOD_DECLARATION;
        }
        if (node instanceof BodyDeclaration<?>) {
            return NodeTypes.MEMBER;
        }
        return NodeTypes.STATEMENT;
    }

    private static boolean inInterface(FieldDeclaration field) {
        return field.getParentNode()
                .filter(parent -> parent instanceof ClassOrInterfaceDeclaration type && type.isInterface())
                .isPresent();
    }

    static String modifierType(Modifier.Keyword keyword) {
        return switch (keyword) {
            case PUBLIC, PROTECTED, PRIVATE -> NodeTypes.VISIBILITY_MODIFIER;
            case STATIC -> NodeTypes.STATIC_MODIFIER;
            case FINAL -> NodeTypes.FINAL_MODIFIER;
            case ABSTRACT -> NodeTypes.ABSTRACT_MODIFIER;
            default -> NodeTypes.MODIFIER;
        };
    }
}
