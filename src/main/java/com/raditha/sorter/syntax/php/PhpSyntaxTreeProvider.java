package com.raditha.sorter.syntax.php;

import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.syntax.SourceTree;
import com.raditha.sorter.syntax.SyntaxTree;
import com.raditha.sorter.syntax.SyntaxTreeProvider;

/**
 * Statement-level PHP parser.
 * <p>
 * It recognises namespaces, namespace imports, class-like declarations and their members
 * (trait uses, constants, properties, methods) and keeps comments as sibling nodes. It is
 * tolerant: unbalanced input still yields a tree.
 */
public class PhpSyntaxTreeProvider implements SyntaxTreeProvider {

    @Override
    public Language language() {
        return Language.PHP;
    }

    @Override
    public SyntaxTree parse(String text) {
        PhpLexer lexer = new PhpLexer(text);
        PhpStatementParser parser = new PhpStatementParser(text, lexer.tokenize());
        return new SourceTree(parser.parse(), Language.PHP);
    }
}
