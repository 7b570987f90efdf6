package com.raditha.sorter.diagnostics;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds Java imports whose simple name is never referenced.
 * <p>
 * Every identifier outside the package and import declarations counts as a reference, as do
 * {@code {@link}} and {@code @see} targets in comments. Wildcard imports are never reported.
 */
public class JavaImportUsageAnalyzer implements ImportUsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(JavaImportUsageAnalyzer.class);
    private static final Pattern DOC_REFERENCE = Pattern.compile(
            "(?:\\{@(?:link|linkplain|value)|@see|@throws|@exception)\\s+([A-Za-z_$][\\w$]*)");

    private final JavaParser parser = new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Override
    public List<Diagnostic> findUnusedImports(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            logger.warn("Cannot analyze imports: {}", result.getProblems());
            return List.of();
        }
        CompilationUnit cu = result.getResult().get();
        Set<String> referenced = collectReferences(cu);

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ImportDeclaration declaration : cu.getImports()) {
            if (declaration.isAsterisk() || declaration.getBegin().isEmpty()) {
                continue;
            }
            String simpleName = declaration.getName().getIdentifier();
            if (!referenced.contains(simpleName)) {
                diagnostics.add(new Diagnostic(declaration.getBegin().get().line,
                        "Import '" + declaration.getNameAsString() + "' is declared but not used"));
            }
        }
        return diagnostics;
    }

    private static Set<String> collectReferences(CompilationUnit cu) {
        Set<String> referenced = new HashSet<>();
        for (SimpleName name : cu.findAll(SimpleName.class)) {
            if (!inHeader(name)) {
                referenced.add(name.getIdentifier());
            }
        }
        for (Name name : cu.findAll(Name.class)) {
            if (!inHeader(name)) {
                Name leftmost = name;
                while (leftmost.getQualifier().isPresent()) {
                    leftmost = leftmost.getQualifier().get();
                }
                referenced.add(leftmost.getIdentifier());
            }
        }
        for (Comment comment : cu.getAllContainedComments()) {
            Matcher matcher = DOC_REFERENCE.matcher(comment.getContent());
            while (matcher.find()) {
                referenced.add(matcher.group(1));
            }
        }
        return referenced;
    }

    private static boolean inHeader(Node node) {
        for (Node current = node; current != null; current = current.getParentNode().orElse(null)) {
            if (current instanceof ImportDeclaration || current instanceof PackageDeclaration) {
                return true;
            }
        }
        return false;
    }
}
