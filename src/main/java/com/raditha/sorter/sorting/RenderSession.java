package com.raditha.sorter.sorting;

import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Visibility;
import com.raditha.sorter.model.WriteFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling render state for one sorter invocation.
 * <p>
 * The previous category and visibility carry over from one rendered group to the next; they
 * are cleared by {@link #reset()}. The category is also cleared by {@link #startScope()}, so a
 * constant group in one class never spaces the properties of the next.
 */
public class RenderSession {
    private Category previousCategory;
    private Visibility previousVisibility;
    private final List<WriteFailure> failures = new ArrayList<>();
    private int rewrittenGroups;

    public void reset() {
        previousCategory = null;
        previousVisibility = null;
        failures.clear();
        rewrittenGroups = 0;
    }

    public void startScope() {
        previousCategory = null;
    }

    public Category getPreviousCategory() {
        return previousCategory;
    }

    void setPreviousCategory(Category previousCategory) {
        this.previousCategory = previousCategory;
    }

    public Visibility getPreviousVisibility() {
        return previousVisibility;
    }

    void setPreviousVisibility(Visibility previousVisibility) {
        this.previousVisibility = previousVisibility;
    }

    void addFailure(WriteFailure failure) {
        failures.add(failure);
    }

    public List<WriteFailure> getFailures() {
        return List.copyOf(failures);
    }

    void recordRewrite() {
        rewrittenGroups++;
    }

    public int getRewrittenGroups() {
        return rewrittenGroups;
    }
}
