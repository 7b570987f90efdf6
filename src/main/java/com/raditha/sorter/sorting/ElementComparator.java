package com.raditha.sorter.sorting;

import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.Visibility;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Canonical element order: visibility rank first (when enabled), then the statement text
 * compared code point by code point.
 * <p>
 * Never looks at positions, so equal elements are left in source order by a stable sort.
 */
public class ElementComparator implements Comparator<Element> {

    private final boolean useVisibility;
    private final Visibility defaultVisibility;

    /**
     * @param useVisibility     order by visibility rank before text
     * @param defaultVisibility visibility of elements without an explicit modifier
     * @throws IllegalArgumentException if the default visibility is null
     */
    public ElementComparator(boolean useVisibility, Visibility defaultVisibility) {
        if (defaultVisibility == null) {
            throw new IllegalArgumentException("defaultVisibility cannot be null");
        }
        this.useVisibility = useVisibility;
        this.defaultVisibility = defaultVisibility;
    }

    /**
     * @param defaultVisibility keyword such as "public"
     * @throws IllegalArgumentException if the keyword is not public, protected or private
     */
    public ElementComparator(boolean useVisibility, String defaultVisibility) {
        this(useVisibility, Visibility.fromString(defaultVisibility));
    }

    @Override
    public int compare(Element a, Element b) {
        if (useVisibility) {
            int byRank = Integer.compare(visibilityOf(a).rank(), visibilityOf(b).rank());
            if (byRank != 0) {
                return byRank;
            }
        }
        return compareOrdinal(a.sortKey(), b.sortKey());
    }

    /**
     * True iff {@code a} sorts strictly before {@code b}.
     */
    public boolean precedes(Element a, Element b) {
        return compare(a, b) < 0;
    }

    /**
     * Explicit visibility of the element, or the configured default when it has none or
     * the modifier is not a visibility keyword.
     */
    public Visibility visibilityOf(Element element) {
        String modifier = element.visibilityModifier();
        if (modifier == null) {
            return defaultVisibility;
        }
        try {
            return Visibility.fromString(modifier);
        } catch (IllegalArgumentException e) {
            return defaultVisibility;
        }
    }

    public boolean usesVisibility() {
        return useVisibility;
    }

    public Visibility getDefaultVisibility() {
        return defaultVisibility;
    }

    static int compareOrdinal(String a, String b) {
        return Arrays.compare(a.codePoints().toArray(), b.codePoints().toArray());
    }
}
