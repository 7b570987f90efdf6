package com.raditha.sorter.config;

import com.raditha.sorter.model.Visibility;
import com.raditha.sorter.syntax.Language;

/**
 * Settings for one sorter run. Immutable for the duration of the run.
 *
 * @param sortProperties                      sort property groups
 * @param sortTraits                          sort trait-use groups
 * @param sortNamespaceUses                   sort namespace imports
 * @param sortConstants                       sort constant groups
 * @param removeUnusedImports                 delete imports reported as unused (needs sortNamespaceUses)
 * @param addNewlineBetweenConstAndProperties blank line when a property follows a constant
 * @param addVisibilitySpacing                blank line between property visibility groups
 * @param defaultVisibility                   visibility of declarations without a modifier
 * @param language                            language the sorter is configured for
 */
public record SorterConfig(
        boolean sortProperties,
        boolean sortTraits,
        boolean sortNamespaceUses,
        boolean sortConstants,
        boolean removeUnusedImports,
        boolean addNewlineBetweenConstAndProperties,
        boolean addVisibilitySpacing,
        Visibility defaultVisibility,
        Language language) {

    public SorterConfig {
        if (defaultVisibility == null) {
            throw new IllegalArgumentException("defaultVisibility cannot be null");
        }
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
    }

    /**
     * Everything enabled, public default visibility, PHP.
     */
    public static SorterConfig defaults() {
        return new SorterConfig(true, true, true, true, true, true, true, Visibility.PUBLIC, Language.PHP);
    }

    /**
     * Whether unused imports are pruned in this run.
     */
    public boolean pruneImports() {
        return removeUnusedImports && sortNamespaceUses;
    }

    public SorterConfig withLanguage(Language language) {
        return new SorterConfig(sortProperties, sortTraits, sortNamespaceUses, sortConstants, removeUnusedImports,
                addNewlineBetweenConstAndProperties, addVisibilitySpacing, defaultVisibility, language);
    }

    public SorterConfig withRemoveUnusedImports(boolean removeUnusedImports) {
        return new SorterConfig(sortProperties, sortTraits, sortNamespaceUses, sortConstants, removeUnusedImports,
                addNewlineBetweenConstAndProperties, addVisibilitySpacing, defaultVisibility, language);
    }
}
