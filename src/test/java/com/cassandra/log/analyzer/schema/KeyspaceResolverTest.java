package com.cassandra.log.analyzer.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KeyspaceResolverTest {

    private AmbiguityIndex index;

    @BeforeEach
    public void setUp() throws Exception {
        index = AmbiguityIndex.build(SchemaParser.parse(String.join("\n",
                "CREATE TABLE ks1.users (id text PRIMARY KEY, name text);",
                "CREATE TABLE ks2.users (id text PRIMARY KEY, name text);",
                "CREATE TABLE ks1.orders (id text PRIMARY KEY, total int);")));
    }

    @Test
    public void testQualifiedSegment() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Collections.emptyMap());

        assertEquals(new TableRef("ks9", "carts"), resolver.resolve("KS9.Carts", List.of()));
    }

    @Test
    public void testQuotedQualifiedSegment() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Collections.emptyMap());

        assertEquals(new TableRef("ks1", "users"), resolver.resolve("\"ks1\".\"users\"", List.of()));
    }

    @Test
    public void testUniqueBareTable() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Collections.emptyMap());

        TableRef ref = resolver.resolve("orders", List.of());
        assertEquals("ks1", ref.getKeyspace());
        assertTrue(ref.isKeyspaceResolved());
    }

    @Test
    public void testAmbiguousBareTableWithoutTags() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Collections.emptyMap());

        TableRef ref = resolver.resolve("users", List.of("prod"));
        assertEquals(AmbiguityIndex.AMBIGUOUS, ref.getKeyspace());
        assertFalse(ref.isKeyspaceResolved());
    }

    @Test
    public void testTagOverrideForAmbiguousTable() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Map.of("app-b", "KS2"));

        TableRef ref = resolver.resolve("users", List.of("prod", "app-b"));
        assertEquals(new TableRef("ks2", "users"), ref);
    }

    @Test
    public void testFirstMappedTagWins() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("app-a", "ks1");
        tags.put("app-b", "ks2");
        KeyspaceResolver resolver = new KeyspaceResolver(index, tags);

        assertEquals("ks2", resolver.resolve("users", List.of("app-b", "app-a")).getKeyspace());
    }

    @Test
    public void testTagOverrideForUnknownTable() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Map.of("app-b", "ks2"));

        assertEquals("ks2", resolver.resolve("sessions", List.of("app-b")).getKeyspace());
    }

    @Test
    public void testTagsIgnoredForUniqueTable() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Map.of("app-b", "ks2"));

        assertEquals("ks1", resolver.resolve("orders", List.of("app-b")).getKeyspace());
    }

    @Test
    public void testUnknownTableWithoutMapping() {
        KeyspaceResolver resolver = new KeyspaceResolver(index, Map.of("app-b", "ks2"));

        TableRef ref = resolver.resolve("sessions", List.of("other"));
        assertNull(ref.getKeyspace());
        assertEquals("sessions", ref.getTable());
    }
}
