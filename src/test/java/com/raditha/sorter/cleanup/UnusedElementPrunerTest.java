package com.raditha.sorter.cleanup;

import com.raditha.sorter.buffer.BufferWriteException;
import com.raditha.sorter.buffer.InMemoryLineBuffer;
import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Comment;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.Range;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class UnusedElementPrunerTest {

    private static Element use(int line, String text) {
        return new Element(Category.IMPORT_USE, new Range(line, line), List.of(text), text, null, null);
    }

    private static List<Element> imports() {
        return List.of(
                use(1, "use A;"),
                use(2, "use B;"),
                new Element(Category.IMPORT_USE, new Range(4, 4), List.of("use C;"), "use C;",
                        new Comment(new Range(3, 3), List.of("// c")), null),
                use(5, "use D;"),
                use(6, "use E;"));
    }

    @Test
    void testRemovesExactlyTheFlaggedSpans() {
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(
                List.of("use A;", "use B;", "// c", "use C;", "use D;", "use E;"));
        UnusedElementPruner pruner = new UnusedElementPruner(buffer);

        int removed = pruner.pruneUnused(imports(), Set.of(2, 4, 6)::contains);

        assertEquals(3, removed);
        assertEquals(List.of("use A;", "use D;"), buffer.lines());
        assertTrue(pruner.getFailures().isEmpty());
    }

    @Test
    void testOracleIsAskedHighestLineFirst() {
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(
                List.of("use A;", "use B;", "// c", "use C;", "use D;", "use E;"));
        List<Integer> asked = new ArrayList<>();

        new UnusedElementPruner(buffer).pruneUnused(imports(), line -> {
            asked.add(line);
            return false;
        });

        assertEquals(List.of(6, 5, 4, 2, 1), asked);
        assertEquals(0, buffer.version());
    }

    @Test
    void testFailedDeletionDoesNotStopTheRest() throws BufferWriteException {
        LineBuffer buffer = mock(LineBuffer.class);
        doThrow(new BufferWriteException("locked")).when(buffer).setLines(eq(3), eq(4), anyList());
        UnusedElementPruner pruner = new UnusedElementPruner(buffer);

        int removed = pruner.pruneUnused(imports(), Set.of(2, 4)::contains);

        assertEquals(1, removed);
        assertEquals(1, pruner.getFailures().size());
        assertEquals(new Range(3, 4), pruner.getFailures().get(0).range());
        assertThrows(UnsupportedOperationException.class, () -> pruner.getFailures().clear());
        verify(buffer).setLines(2, 2, List.of());
    }
}
