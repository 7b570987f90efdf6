package com.raditha.sorter.workflow;

import com.raditha.sorter.buffer.InMemoryLineBuffer;
import com.raditha.sorter.config.SorterConfig;
import com.raditha.sorter.diagnostics.Diagnostic;
import com.raditha.sorter.diagnostics.DiagnosticsProvider;
import com.raditha.sorter.diagnostics.SourceDiagnostics;
import com.raditha.sorter.model.LanguageMismatchException;
import com.raditha.sorter.model.MissingParserException;
import com.raditha.sorter.model.Visibility;
import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.syntax.SyntaxException;
import com.raditha.sorter.syntax.SyntaxTreeProvider;
import com.raditha.sorter.syntax.SyntaxTreeProviders;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ElementSorterTest {

    private static final String PHP_USER = """
            <?php

            namespace App;

            use Foo\\Zeta;
            use Foo\\Alpha;

            use Foo\\Unused;

            class User
            {
                use TraitB;
                use TraitA;

                const B = 2;
                const A = 1;

                public $name;
                /** Identifier */
                private $id;
                protected $email;

                public function run(Zeta $z, Alpha $a) {}
            }""";

    private static final String PHP_USER_SORTED = """
            <?php

            namespace App;

            use Foo\\Alpha;
            use Foo\\Zeta;

            class User
            {
                use TraitA;
                use TraitB;

                const A = 1;
                const B = 2;

                /** Identifier */
                private $id;

                protected $email;

                public $name;

                public function run(Zeta $z, Alpha $a) {}
            }""";

    private static final String JAVA_DEMO = """
            package demo;

            import java.util.Map;
            import java.util.List;

            public class Demo {
                public static final int B = 2;
                private static final int A = 1;

                public String name;
                private List<String> items;
                private Map<String, String> map;
            }""";

    private static final String JAVA_DEMO_SORTED = """
            package demo;

            import java.util.List;
            import java.util.Map;

            public class Demo {
                private static final int A = 1;

                public static final int B = 2;

                private List<String> items;
                private Map<String, String> map;

                public String name;
            }""";

    @Test
    void testSortsPhpClassAndPrunesUnusedImport() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults());

        SortResult result = sorter.sortElements(buffer, SourceDiagnostics.forLanguage(buffer, Language.PHP));

        assertEquals(PHP_USER_SORTED, buffer.text());
        assertEquals(4, result.getSortedGroups());
        assertEquals(1, result.getRemovedElements());
        assertFalse(result.hasFailures());
        assertTrue(result.isModified());
    }

    @Test
    void testSecondRunChangesNothing() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults());
        sorter.sortElements(buffer, SourceDiagnostics.forLanguage(buffer, Language.PHP));
        long version = buffer.version();

        SortResult again = sorter.sortElements(buffer, SourceDiagnostics.forLanguage(buffer, Language.PHP));

        assertFalse(again.isModified());
        assertEquals(0, again.getSortedGroups());
        assertEquals(version, buffer.version());
    }

    @Test
    void testKeepsImportsWhenPruningDisabled() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults().withRemoveUnusedImports(false));

        SortResult result = sorter.sortElements(buffer, SourceDiagnostics.forLanguage(buffer, Language.PHP));

        assertEquals(0, result.getRemovedElements());
        assertTrue(buffer.text().contains("use Foo\\Unused;"));
    }

    @Test
    void testPrunesOnlyWhatDiagnosticsReport() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of("""
                <?php

                use B\\Two;
                use A\\One;

                echo One::X;""");
        DiagnosticsProvider diagnostics = line -> "use B\\Two;".equals(buffer.lines().get(line - 1))
                ? List.of(new Diagnostic(line, "Symbol 'Two' is declared but not used."))
                : List.of();

        SortResult result = new ElementSorter(SorterConfig.defaults()).sortElements(buffer, diagnostics);

        assertEquals(1, result.getRemovedElements());
        assertEquals(List.of("<?php", "", "use A\\One;", "", "echo One::X;"), buffer.lines());
    }

    @Test
    void testModuleScopeWithoutClasses() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of("""
                <?php

                use B\\Two;
                use A\\One;

                echo One::X, Two::Y;""");

        SortResult result = new ElementSorter(SorterConfig.defaults())
                .sortElements(buffer, DiagnosticsProvider.NONE);

        assertEquals(1, result.getSortedGroups());
        assertEquals(List.of("<?php", "", "use A\\One;", "use B\\Two;", "", "echo One::X, Two::Y;"),
                buffer.lines());
    }

    @Test
    void testSortsJavaClass() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(JAVA_DEMO);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults().withLanguage(Language.JAVA));

        SortResult result = sorter.sortElements(buffer, SourceDiagnostics.forLanguage(buffer, Language.JAVA));

        assertEquals(JAVA_DEMO_SORTED, buffer.text());
        assertEquals(0, result.getRemovedElements());
        assertFalse(sorter.sortElements(buffer, DiagnosticsProvider.NONE).isModified());
    }

    @Test
    void testConstantsOfOneClassDoNotSpaceTheNextClass() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of("""
                <?php

                class A
                {
                    const B = 2;
                    const A = 1;
                }

                class B
                {
                    public $b;
                    public $a;
                }""");
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults());

        SortResult result = sorter.sortElements(buffer, DiagnosticsProvider.NONE);

        assertEquals(2, result.getSortedGroups());
        assertEquals(List.of("<?php", "", "class A", "{", "    const A = 1;", "    const B = 2;", "}", "",
                "class B", "{", "    public $a;", "    public $b;", "}"), buffer.lines());
        assertFalse(sorter.sortElements(buffer, DiagnosticsProvider.NONE).isModified());
    }

    @Test
    void testLanguageMismatchLeavesBufferAlone() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(JAVA_DEMO);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults());

        assertThrows(LanguageMismatchException.class,
                () -> sorter.sortElements(buffer, Language.JAVA, DiagnosticsProvider.NONE));
        assertEquals(0, buffer.version());
    }

    @Test
    void testMissingProviderIsReported() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults(), new SyntaxTreeProviders());

        assertThrows(MissingParserException.class, () -> sorter.sortElements(buffer, DiagnosticsProvider.NONE));
        assertEquals(0, buffer.version());
    }

    @Test
    void testUnparseableBufferIsReported() {
        SyntaxTreeProvider provider = mock(SyntaxTreeProvider.class);
        when(provider.language()).thenReturn(Language.PHP);
        when(provider.parse(anyString())).thenThrow(new SyntaxException("unexpected end of input"));
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        ElementSorter sorter = new ElementSorter(SorterConfig.defaults(), new SyntaxTreeProviders().register(provider));

        MissingParserException e = assertThrows(MissingParserException.class,
                () -> sorter.sortElements(buffer, DiagnosticsProvider.NONE));
        assertInstanceOf(SyntaxException.class, e.getCause());
        assertEquals(0, buffer.version());
    }

    @Test
    void testDisabledCategoriesAreLeftAsWritten() {
        InMemoryLineBuffer buffer = InMemoryLineBuffer.of(PHP_USER);
        SorterConfig config = new SorterConfig(false, false, false, true, true, true, true,
                Visibility.PUBLIC, Language.PHP);

        SortResult result = new ElementSorter(config).sortElements(buffer, DiagnosticsProvider.NONE);

        assertEquals(1, result.getSortedGroups());
        String text = buffer.text();
        assertTrue(text.indexOf("use Foo\\Zeta;") < text.indexOf("use Foo\\Alpha;"));
        assertTrue(text.indexOf("use TraitB;") < text.indexOf("use TraitA;"));
        assertTrue(text.indexOf("const A = 1;") < text.indexOf("const B = 2;"));
        assertTrue(text.contains("use Foo\\Unused;"));
    }
}
