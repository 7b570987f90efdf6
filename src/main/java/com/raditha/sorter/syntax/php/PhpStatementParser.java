package com.raditha.sorter.syntax.php;

import com.raditha.sorter.syntax.LineIndex;
import com.raditha.sorter.syntax.NodeTypes;
import com.raditha.sorter.syntax.SourceNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups PHP tokens into statement nodes.
 * <p>
 * The tree is statement-level only: module statements, class-like declarations with their
 * members, and comments as separate siblings. Declaration members carry their leading
 * modifier keywords as children.
 */
class PhpStatementParser {

    private enum Context {
        MODULE,
        CLASS
    }

    private static final Map<String, String> MODIFIER_TYPES = Map.of(
            "public", NodeTypes.VISIBILITY_MODIFIER,
            "protected", NodeTypes.VISIBILITY_MODIFIER,
            "private", NodeTypes.VISIBILITY_MODIFIER,
            "static", NodeTypes.STATIC_MODIFIER,
            "readonly", NodeTypes.READONLY_MODIFIER,
            "final", NodeTypes.FINAL_MODIFIER,
            "abstract", NodeTypes.ABSTRACT_MODIFIER,
            "var", NodeTypes.VAR_MODIFIER);

    private static final Map<String, String> CLASS_LIKE_TYPES = Map.of(
            "class", NodeTypes.CLASS_DECLARATION,
            "trait", NodeTypes.TRAIT_DECLARATION,
            "interface", NodeTypes.INTERFACE_DECLARATION,
            "enum", NodeTypes.ENUM_DECLARATION);

    private static final Set<String> CONTINUATION_WORDS = Set.of("else", "elseif", "catch", "finally", "while");

    private static final Set<String> CONTINUATION_PUNCT = Set.of(
            ";", ",", ")", "]", "-", ".", "?", ":", "(", "[", "=", "+", "*", "/", "|", "&", "<", ">", "!");

    private final String src;
    private final List<PhpToken> tokens;
    private final LineIndex index;
    private int pos;

    PhpStatementParser(String src, List<PhpToken> tokens) {
        this.src = src;
        this.tokens = tokens;
        this.index = new LineIndex(src);
    }

    SourceNode parse() {
        SourceNode root = new SourceNode(NodeTypes.PROGRAM, index.rangeOf(0, src.length()), src);
        pos = 0;
        parseBlock(root, Context.MODULE, tokens.size());
        return root;
    }

    /**
     * Parse statements into {@code parent} up to (not including) token {@code limit}.
     */
    private void parseBlock(SourceNode parent, Context context, int limit) {
        while (pos < limit) {
            PhpToken token = tokens.get(pos);
            switch (token.kind()) {
                case OPEN_TAG, CLOSE_TAG, INLINE_HTML -> pos++;
                case COMMENT -> {
                    parent.addChild(node(NodeTypes.COMMENT, pos, pos));
                    pos++;
                }
                default -> {
                    if (token.isPunct(";") || token.isPunct("}")) {
                        pos++;
                    } else if (context == Context.MODULE) {
                        parseModuleStatement(parent, limit);
                    } else {
                        parseMember(parent, limit);
                    }
                }
            }
        }
    }

    private void parseModuleStatement(SourceNode parent, int limit) {
        int first = pos;
        int keyword = skipHead(first, limit, false);
        PhpToken head = keyword < limit ? tokens.get(keyword) : null;
        String word = head != null && head.is(PhpToken.Kind.WORD) ? head.text().toLowerCase(Locale.ROOT) : "";

        if (word.equals("namespace") && !nextIsPunct(keyword, "(")) {
            int open = findAtDepthZero(keyword, limit, "{");
            int end = findStatementEnd(keyword, limit, false);
            if (open >= 0 && open <= end) {
                int close = findMatching(open, limit);
                SourceNode namespace = parent.addChild(node(NodeTypes.NAMESPACE_DEFINITION, first, close));
                pos = open + 1;
                parseBlock(namespace, Context.MODULE, close);
                pos = close + 1;
            } else {
                parent.addChild(node(NodeTypes.NAMESPACE_DEFINITION, first, end));
                pos = end + 1;
            }
            return;
        }

        if (word.equals("use")) {
            int end = findStatementEnd(keyword, limit, true);
            parent.addChild(node(NodeTypes.NAMESPACE_USE_DECLARATION, first, end));
            pos = end + 1;
            return;
        }

        String classLike = CLASS_LIKE_TYPES.get(word);
        if (classLike != null && keyword + 1 < limit && tokens.get(keyword + 1).is(PhpToken.Kind.WORD)) {
            int open = findAtDepthZero(keyword, limit, "{");
            if (open >= 0) {
                int close = findMatching(open, limit);
                SourceNode declaration = parent.addChild(node(classLike, first, close));
                pos = open + 1;
                parseBlock(declaration, Context.CLASS, close);
                pos = close + 1;
                return;
            }
        }

        int end = findStatementEnd(first, limit, !word.equals("function"));
        parent.addChild(node(word.equals("function") ? NodeTypes.FUNCTION_DEFINITION : NodeTypes.STATEMENT,
                first, end));
        pos = end + 1;
    }

    private void parseMember(SourceNode parent, int limit) {
        int first = pos;
        int keyword = skipHead(first, limit, true);
        PhpToken head = keyword < limit ? tokens.get(keyword) : null;
        int end = findStatementEnd(first, limit, false);

        String type;
        if (head == null) {
            type = NodeTypes.MEMBER;
        } else if (head.isWord("use")) {
            type = NodeTypes.USE_DECLARATION;
        } else if (head.isWord("const")) {
            type = NodeTypes.CONST_DECLARATION;
        } else if (head.isWord("function")) {
            type = NodeTypes.METHOD_DECLARATION;
        } else if (declaresVariable(keyword, end)) {
            type = NodeTypes.PROPERTY_DECLARATION;
        } else {
            type = NodeTypes.MEMBER;
        }

        SourceNode member = parent.addChild(node(type, first, end));
        addModifiers(member, first, keyword);
        pos = end + 1;
    }

    /**
     * Whether a variable appears at depth zero before any initializer.
     */
    private boolean declaresVariable(int from, int end) {
        int depth = 0;
        for (int i = from; i <= end; i++) {
            PhpToken token = tokens.get(i);
            if (token.opens()) {
                depth++;
            } else if (token.closes()) {
                depth--;
            } else if (depth == 0 && token.isPunct("=")) {
                return false;
            } else if (depth == 0 && token.is(PhpToken.Kind.VARIABLE)) {
                return true;
            }
        }
        return false;
    }

    private void addModifiers(SourceNode member, int first, int keyword) {
        int i = first;
        while (i < keyword) {
            PhpToken token = tokens.get(i);
            if (token.is(PhpToken.Kind.ATTRIBUTE_START) || token.isPunct("(")) {
                i = findMatching(i, keyword) + 1;
                continue;
            }
            if (token.is(PhpToken.Kind.WORD)) {
                String type = MODIFIER_TYPES.get(token.text().toLowerCase(Locale.ROOT));
                if (type != null) {
                    member.addChild(node(type, i, i));
                }
            }
            i++;
        }
    }

    /**
     * Index of the first token after attributes, comments and (when requested) modifiers.
     */
    private int skipHead(int from, int limit, boolean skipModifiers) {
        int i = from;
        while (i < limit) {
            PhpToken token = tokens.get(i);
            if (token.is(PhpToken.Kind.ATTRIBUTE_START)) {
                i = findMatching(i, limit) + 1;
            } else if (token.is(PhpToken.Kind.COMMENT)) {
                i++;
            } else if (token.is(PhpToken.Kind.WORD) && isModifier(token, skipModifiers)) {
                i++;
                if (i < limit && tokens.get(i).isPunct("(")) {
                    i = findMatching(i, limit) + 1;
                }
            } else {
                return i;
            }
        }
        return limit;
    }

    private static boolean isModifier(PhpToken token, boolean memberModifiers) {
        String word = token.text().toLowerCase(Locale.ROOT);
        if (memberModifiers) {
            return MODIFIER_TYPES.containsKey(word);
        }
        return word.equals("abstract") || word.equals("final") || word.equals("readonly");
    }

    /**
     * Index of the last token of the statement starting at {@code from}.
     *
     * @param continueAfterBlock whether a closing brace at depth zero may be followed by more of
     *                           the same statement (else branches, trailing semicolons)
     */
    private int findStatementEnd(int from, int limit, boolean continueAfterBlock) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            PhpToken token = tokens.get(i);
            if (token.is(PhpToken.Kind.CLOSE_TAG) && depth == 0) {
                return Math.max(from, i - 1);
            }
            if (token.opens()) {
                depth++;
            } else if (token.closes()) {
                if (depth == 0) {
                    return Math.max(from, i - 1);
                }
                depth--;
                if (depth == 0 && token.isPunct("}") && !(continueAfterBlock && continues(i + 1, limit))) {
                    return i;
                }
            } else if (depth == 0 && token.isPunct(";")) {
                return i;
            }
        }
        return limit - 1;
    }

    private boolean continues(int next, int limit) {
        if (next >= limit) {
            return false;
        }
        PhpToken token = tokens.get(next);
        if (token.is(PhpToken.Kind.WORD)) {
            return CONTINUATION_WORDS.contains(token.text().toLowerCase(Locale.ROOT));
        }
        return token.is(PhpToken.Kind.PUNCT) && CONTINUATION_PUNCT.contains(token.text());
    }

    private int findAtDepthZero(int from, int limit, String punct) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            PhpToken token = tokens.get(i);
            if (depth == 0 && token.isPunct(punct)) {
                return i;
            }
            if (depth == 0 && token.isPunct(";")) {
                return -1;
            }
            if (token.opens()) {
                depth++;
            } else if (token.closes()) {
                depth--;
            }
        }
        return -1;
    }

    /**
     * Index of the token closing the group opened at {@code open}, or the last token before
     * {@code limit} when the group is unbalanced.
     */
    private int findMatching(int open, int limit) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            PhpToken token = tokens.get(i);
            if (token.opens()) {
                depth++;
            } else if (token.closes()) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return limit - 1;
    }

    private boolean nextIsPunct(int index, String punct) {
        return index + 1 < tokens.size() && tokens.get(index + 1).isPunct(punct);
    }

    private SourceNode node(String type, int firstToken, int lastToken) {
        int start = tokens.get(firstToken).start();
        int end = tokens.get(lastToken).end();
        return new SourceNode(type, index.rangeOf(start, end), index.slice(start, end));
    }
}
