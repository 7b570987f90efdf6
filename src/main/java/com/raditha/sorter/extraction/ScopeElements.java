package com.raditha.sorter.extraction;

import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Element;

import java.util.List;

/**
 * Declarations extracted from one scope, split by category, each list in source order.
 */
public record ScopeElements(List<Element> traits, List<Element> constants, List<Element> properties) {

    public ScopeElements {
        traits = List.copyOf(traits);
        constants = List.copyOf(constants);
        properties = List.copyOf(properties);
    }

    public List<Element> get(Category category) {
        return switch (category) {
            case TRAIT_USE -> traits;
            case CONSTANT -> constants;
            case PROPERTY -> properties;
            case IMPORT_USE -> List.of();
        };
    }

    public boolean isEmpty() {
        return traits.isEmpty() && constants.isEmpty() && properties.isEmpty();
    }
}
