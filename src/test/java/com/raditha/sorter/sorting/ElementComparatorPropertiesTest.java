package com.raditha.sorter.sorting;

import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.Visibility;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The comparator must be a strict weak ordering for List.sort to be well defined.
 */
class ElementComparatorPropertiesTest {

    private final ElementComparator comparator = new ElementComparator(true, Visibility.PROTECTED);

    @Provide
    Arbitrary<Element> properties() {
        Arbitrary<String> names = Arbitraries.strings().withCharRange('a', 'e').ofMinLength(1).ofMaxLength(3);
        Arbitrary<String> modifiers = Arbitraries.of("public", "protected", "private", "");
        return Combinators.combine(names, modifiers).as((name, modifier) -> ElementComparatorTest.element(
                Category.PROPERTY,
                (modifier.isEmpty() ? "var" : modifier) + " $" + name + ";",
                modifier.isEmpty() ? null : modifier));
    }

    @Property
    void antisymmetric(@ForAll("properties") Element a, @ForAll("properties") Element b) {
        assertEquals(Integer.signum(comparator.compare(a, b)), -Integer.signum(comparator.compare(b, a)));
    }

    @Property
    void transitive(@ForAll("properties") Element a, @ForAll("properties") Element b,
            @ForAll("properties") Element c) {
        if (comparator.compare(a, b) <= 0 && comparator.compare(b, c) <= 0) {
            assertTrue(comparator.compare(a, c) <= 0);
        }
    }

    @Property
    void irreflexivePrecedes(@ForAll("properties") Element a) {
        assertFalse(comparator.precedes(a, a));
    }
}
