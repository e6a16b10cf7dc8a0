package com.cassandra.log.analyzer.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class AmbiguityIndexTest {

    private static SchemaCatalog catalog() {
        return new SchemaCatalog(Map.of(
                "ks1", Map.of("users", new TableKeys(List.of("id"), List.of()),
                        "orders", new TableKeys(List.of("id"), List.of())),
                "ks2", Map.of("users", new TableKeys(List.of("id"), List.of()))));
    }

    @Test
    public void testUniqueTable() {
        AmbiguityIndex index = AmbiguityIndex.build(catalog());

        assertEquals("ks1", index.getKeyspace("orders"));
        assertTrue(index.contains("orders"));
        assertFalse(index.isAmbiguous("orders"));
    }

    @Test
    public void testTableInTwoKeyspacesIsAmbiguous() {
        AmbiguityIndex index = AmbiguityIndex.build(catalog());

        assertEquals(AmbiguityIndex.AMBIGUOUS, index.getKeyspace("users"));
        assertTrue(index.isAmbiguous("users"));
        assertEquals(2, index.size());
    }

    @Test
    public void testUnknownTable() {
        AmbiguityIndex index = AmbiguityIndex.build(catalog());

        assertNull(index.getKeyspace("missing"));
        assertFalse(index.contains("missing"));
        assertFalse(index.isAmbiguous("missing"));
    }

    @Test
    public void testIsResolved() {
        assertTrue(AmbiguityIndex.isResolved("ks1"));
        assertFalse(AmbiguityIndex.isResolved(null));
        assertFalse(AmbiguityIndex.isResolved(AmbiguityIndex.AMBIGUOUS));
    }

    @Test
    public void testEmptyCatalog() {
        assertEquals(0, AmbiguityIndex.build(SchemaCatalog.empty()).size());
    }
}
