package com.nfttrader.backend.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CaffeineStateStoreTest {

    private StateStore<String, List<String>> store;

    @BeforeEach
    void setUp() {
        store = new CaffeineStateStore<>("rules");
    }

    @Test
    void get_shouldReturnStoredValue() {
        store.set("0xowner", List.of("a"));

        assertEquals(Optional.of(List.of("a")), store.get("0xowner"));
        assertTrue(store.get("0xother").isEmpty());
        assertEquals("rules", store.getName());
    }

    @Test
    void getOrCreate_shouldCreateOnlyOnce() {
        List<String> created = store.getOrCreate("0xowner", key -> new ArrayList<>());
        created.add("rule-1");

        List<String> again = store.getOrCreate("0xowner", key -> new ArrayList<>());

        assertSame(created, again);
        assertEquals(List.of("rule-1"), again);
    }

    @Test
    void delete_shouldReportWhetherKeyExisted() {
        store.set("0xowner", List.of("a"));

        assertTrue(store.delete("0xowner"));
        assertFalse(store.delete("0xowner"));
        assertEquals(0, store.size());
    }

    @Test
    void clear_shouldRemoveAllEntries() {
        store.set("0xa", List.of("a"));
        store.set("0xb", List.of("b", "c"));
        assertEquals(2, store.size());
        assertEquals(2, store.values().size());

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.values().isEmpty());
    }
}
