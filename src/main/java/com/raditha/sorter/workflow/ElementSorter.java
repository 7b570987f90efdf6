package com.raditha.sorter.workflow;

import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.cleanup.BlankLineNormalizer;
import com.raditha.sorter.cleanup.UnusedElementPruner;
import com.raditha.sorter.config.SorterConfig;
import com.raditha.sorter.diagnostics.DiagnosticsOracle;
import com.raditha.sorter.diagnostics.DiagnosticsProvider;
import com.raditha.sorter.extraction.ElementExtractor;
import com.raditha.sorter.extraction.ElementGroups;
import com.raditha.sorter.extraction.ScopeElements;
import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.ElementGroup;
import com.raditha.sorter.model.LanguageMismatchException;
import com.raditha.sorter.model.MissingParserException;
import com.raditha.sorter.sorting.ElementComparator;
import com.raditha.sorter.sorting.RenderSession;
import com.raditha.sorter.sorting.SortAndRenderEngine;
import com.raditha.sorter.syntax.Capture;
import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.syntax.NodeQuery;
import com.raditha.sorter.syntax.NodeRange;
import com.raditha.sorter.syntax.SyntaxException;
import com.raditha.sorter.syntax.SyntaxTree;
import com.raditha.sorter.syntax.SyntaxTreeProvider;
import com.raditha.sorter.syntax.SyntaxTreeProviders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs a complete sort over one buffer.
 * <p>
 * Each class body is handled on its own: properties, then constants, then trait uses. A file
 * without classes is handled as a single module scope. Namespace imports are sorted next,
 * unused imports pruned, and finally blank lines are normalized. The tree is parsed again
 * after every write, so no element is ever used with stale line numbers.
 */
public class ElementSorter {

    private static final Logger logger = LoggerFactory.getLogger(ElementSorter.class);
    private static final int MODULE_SCOPE = -1;

    private final SorterConfig config;
    private final SyntaxTreeProviders providers;
    private final ElementExtractor extractor = new ElementExtractor();
    private final RenderSession session = new RenderSession();

    public ElementSorter(SorterConfig config, SyntaxTreeProviders providers) {
        this.config = config;
        this.providers = providers;
    }

    public ElementSorter(SorterConfig config) {
        this(config, SyntaxTreeProviders.standard());
    }

    /**
     * Sort the buffer in place.
     *
     * @param buffer      buffer to sort
     * @param language    language the buffer is written in
     * @param diagnostics source of "unused" reports for import pruning
     * @return what was changed
     * @throws MissingParserException     if the buffer cannot be parsed; nothing is written
     * @throws LanguageMismatchException if the buffer is not in the configured language; nothing is written
     */
    public SortResult sortElements(LineBuffer buffer, Language language, DiagnosticsProvider diagnostics) {
        SyntaxTreeProvider provider = providers.forLanguage(language)
                .orElseThrow(() -> new MissingParserException("No syntax tree provider for " + language.tag()));
        if (language != config.language()) {
            throw new LanguageMismatchException(
                    "Buffer language " + language.tag() + " does not match configured " + config.language().tag());
        }

        Run run = new Run(buffer, provider);
        run.tree();
        session.reset();
        long startVersion = buffer.version();
        SortResult result = new SortResult();

        ElementComparator byVisibility = new ElementComparator(true, config.defaultVisibility());
        ElementComparator byText = new ElementComparator(false, config.defaultVisibility());
        SortAndRenderEngine engine = new SortAndRenderEngine(buffer,
                config.addNewlineBetweenConstAndProperties(), config.addVisibilitySpacing());

        for (int scope : run.scopes()) {
            session.startScope();
            if (config.sortProperties()) {
                sortGroups(run, engine, byVisibility, true, t -> run.scopeElements(t, scope).properties());
            }
            if (config.sortConstants()) {
                sortGroups(run, engine, byVisibility, false, t -> run.scopeElements(t, scope).constants());
            }
            if (config.sortTraits()) {
                sortGroups(run, engine, byText, false, t -> run.scopeElements(t, scope).traits());
            }
        }
        if (config.sortNamespaceUses()) {
            sortGroups(run, engine, byText, false, t -> extractor.extractImports(t, buffer));
        }
        result.addSortedGroups(session.getRewrittenGroups());
        result.addFailures(session.getFailures());

        if (config.pruneImports()) {
            UnusedElementPruner pruner = new UnusedElementPruner(buffer);
            List<Element> imports = extractor.extractImports(run.tree(), buffer);
            result.addRemovedElements(pruner.pruneUnused(imports, new DiagnosticsOracle(diagnostics)));
            result.addFailures(pruner.getFailures());
        }

        normalize(run, result);
        result.setModified(buffer.version() != startVersion);
        logger.info("Sort finished: {}", result);
        return result;
    }

    public SortResult sortElements(LineBuffer buffer, DiagnosticsProvider diagnostics) {
        return sortElements(buffer, config.language(), diagnostics);
    }

    /**
     * Sort the contiguous groups of one category one at a time, re-extracting after each
     * group so that later groups see the shifted lines.
     */
    private void sortGroups(Run run, SortAndRenderEngine engine, ElementComparator comparator,
            boolean propertyGroup, Function<SyntaxTree, List<Element>> elements) {
        for (int index = 0; ; index++) {
            List<ElementGroup> groups = ElementGroups.contiguous(elements.apply(run.tree()), run.buffer);
            if (index >= groups.size()) {
                return;
            }
            engine.sortAndRender(groups.get(index), comparator, propertyGroup, session);
        }
    }

    private void normalize(Run run, SortResult result) {
        BlankLineNormalizer normalizer = new BlankLineNormalizer(run.buffer, config.defaultVisibility(),
                config.addVisibilitySpacing());
        if (config.sortNamespaceUses()) {
            List<ElementGroup> importGroups = ElementGroups.contiguous(
                    extractor.extractImports(run.tree(), run.buffer), run.buffer);
            result.addRemovedBlankLines(normalizer.normalizeImports(importGroups));
        }
        for (int scope : run.scopes()) {
            ScopeElements elements = run.scopeElements(run.tree(), scope);
            List<ElementGroup> groups = new ArrayList<>();
            if (config.sortTraits()) {
                groups.addAll(ElementGroups.contiguous(elements.get(Category.TRAIT_USE), run.buffer));
            }
            if (config.sortConstants()) {
                groups.addAll(ElementGroups.contiguous(elements.get(Category.CONSTANT), run.buffer));
            }
            if (config.sortProperties()) {
                groups.addAll(ElementGroups.contiguous(elements.get(Category.PROPERTY), run.buffer));
            }
            result.addNormalizedGroups(normalizer.normalizeGroups(groups));
        }
        result.addFailures(normalizer.getFailures());
    }

    /**
     * Per-invocation parse cache; the tree is rebuilt only when the buffer has changed.
     */
    private class Run {
        private final LineBuffer buffer;
        private final SyntaxTreeProvider provider;
        private SyntaxTree tree;
        private long treeVersion;

        Run(LineBuffer buffer, SyntaxTreeProvider provider) {
            this.buffer = buffer;
            this.provider = provider;
        }

        SyntaxTree tree() {
            if (tree == null || treeVersion != buffer.version()) {
                try {
                    tree = provider.parse(buffer.text());
                } catch (SyntaxException e) {
                    throw new MissingParserException("Cannot parse buffer: " + e.getMessage(), e);
                }
                treeVersion = buffer.version();
            }
            return tree;
        }

        /**
         * Scope indexes in document order, or the module scope alone when there are no classes.
         */
        List<Integer> scopes() {
            int count = tree().captures(NodeQuery.SCOPES).size();
            List<Integer> scopes = new ArrayList<>();
            if (count == 0) {
                scopes.add(MODULE_SCOPE);
            }
            for (int i = 0; i < count; i++) {
                scopes.add(i);
            }
            return scopes;
        }

        ScopeElements scopeElements(SyntaxTree current, int scope) {
            if (scope == MODULE_SCOPE) {
                return extractor.extract(current, buffer, 0, -1);
            }
            List<Capture> scopes = current.captures(NodeQuery.SCOPES);
            if (scope >= scopes.size()) {
                return new ScopeElements(List.of(), List.of(), List.of());
            }
            NodeRange range = scopes.get(scope).node().range();
            return extractor.extract(current, buffer, range.startRow(), range.endRow());
        }
    }
}
