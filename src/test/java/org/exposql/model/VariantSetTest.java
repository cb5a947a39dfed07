package org.exposql.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class VariantSetTest {
    @Test
    void controlIsNamedOrFirst() {
        assertEquals("control", VariantSet.of("test", "control").controlKey());
        assertEquals("a", VariantSet.of("a", "b").controlKey());
    }

    @Test
    void holdoutIsNeitherControlNorTest() {
        VariantSet variants = VariantSet.of(List.of("control", "test-1", "test-2"), 9L);

        assertEquals(List.of("control", "test-1", "test-2", "holdout-9"), variants.keys());
        assertEquals(List.of("test-1", "test-2"), variants.testKeys());
    }

    @Test
    void rejectsReservedDuplicateAndEmptyKeys() {
        assertThrows(IllegalArgumentException.class, () -> VariantSet.of("control", "$multiple"));
        assertThrows(IllegalArgumentException.class, () -> VariantSet.of("control", "control"));
        assertThrows(IllegalArgumentException.class, () -> VariantSet.of());
        assertThrows(IllegalArgumentException.class, () -> VariantSet.of("control", " "));
    }
}
