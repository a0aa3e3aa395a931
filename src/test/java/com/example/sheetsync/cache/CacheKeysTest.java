package com.example.sheetsync.cache;

import com.example.sheetsync.model.Operation;
import com.example.sheetsync.model.OperationKind;
import com.example.sheetsync.model.Pagination;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    void testOf_FilterOrderDoesNotMatter() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("estado", "Activo");
        first.put("cliente_id", "C1");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("cliente_id", "C1");
        second.put("estado", "Activo");

        // When
        String a = CacheKeys.of(Operation.list("Proyectos", first, null));
        String b = CacheKeys.of(Operation.list("Proyectos", second, null));

        // Then
        assertEquals(a, b);
        assertTrue(a.startsWith("proyectos:list:filters:"));
    }

    @Test
    void testOf_Shapes() {
        assertEquals("proyectos:list", CacheKeys.of(Operation.list("Proyectos", null, null)));
        assertEquals("proyectos:get:P1", CacheKeys.of(Operation.get("Proyectos", "P1")));
        assertEquals("proyectos:list:page:2:25", CacheKeys.of(Operation.list("Proyectos", Map.of(), new Pagination(2, 25))));
    }

    @Test
    void testOf_DifferentFiltersDifferentKeys() {
        String a = CacheKeys.of(Operation.list("Proyectos", Map.of("estado", "Activo"), null));
        String b = CacheKeys.of(Operation.list("Proyectos", Map.of("estado", "Cerrado"), null));
        assertNotEquals(a, b);
    }

    @Test
    void testKindPrefix_MatchesPlainAndFilteredLists() {
        String prefix = CacheKeys.kindPrefix("Actividades", OperationKind.LIST);

        assertTrue(CacheKeys.of(Operation.list("Actividades", null, null)).startsWith(prefix));
        assertTrue(CacheKeys.of(Operation.list("Actividades", Map.of("proyecto_id", "P1"), null)).startsWith(prefix));
        assertFalse(CacheKeys.of(Operation.get("Actividades", "A1")).startsWith(prefix));
    }
}
