package com.gt.vocab.task;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ResourceKeysTests {

    @Test
    public void testResourceKey() {
        String key = ResourceKeys.resourceKey(1, "A", "First option", List.of(HAUS, APFEL));

        assertEquals(64, key.length());
        assertTrue(key.matches("[0-9a-f]+"));
        assertEquals(key, ResourceKeys.resourceKey(1, "A", "First option", List.of(APFEL, HAUS, APFEL)));
    }

    @Test
    public void testResourceKey_DiffersPerInput() {
        String key = ResourceKeys.resourceKey(1, "A", "First option", List.of(HAUS));

        assertNotEquals(key, ResourceKeys.resourceKey(2, "A", "First option", List.of(HAUS)));
        assertNotEquals(key, ResourceKeys.resourceKey(1, "B", "First option", List.of(HAUS)));
        assertNotEquals(key, ResourceKeys.resourceKey(1, "A", "Second option", List.of(HAUS)));
        assertNotEquals(key, ResourceKeys.resourceKey(1, "A", "First option", List.of(APFEL)));
    }
}
