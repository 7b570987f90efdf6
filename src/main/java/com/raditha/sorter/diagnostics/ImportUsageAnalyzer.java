package com.raditha.sorter.diagnostics;

import java.util.List;

/**
 * Reports the imports of a source that nothing in the source refers to.
 */
public interface ImportUsageAnalyzer {

    /**
     * @return one diagnostic per unused import statement, on the statement's first line
     */
    List<Diagnostic> findUnusedImports(String source);
}
