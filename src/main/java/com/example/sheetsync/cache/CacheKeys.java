package com.example.sheetsync.cache;

import com.example.sheetsync.model.Operation;
import com.example.sheetsync.model.OperationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.TreeMap;

/**
 * Deterministic cache keys: {@code table:kind[:id][:filters:<b64>][:page:<p>:<l>]}.
 * The table component is lower-cased so invalidation by table name is case-insensitive.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {
    }

    public static String of(Operation operation) {
        StringBuilder key = new StringBuilder(kindPrefix(operation.getTable(), operation.getKind()));
        if (operation.getId() != null) {
            key.append(':').append(operation.getId());
        }
        if (operation.getFilters() != null && !operation.getFilters().isEmpty()) {
            key.append(":filters:").append(encode(operation));
        }
        if (operation.getPage() != null) {
            key.append(":page:").append(operation.getPage().getPage())
               .append(':').append(operation.getPage().getLimit());
        }
        return key.toString();
    }

    public static String tablePrefix(String table) {
        return table.toLowerCase(Locale.ROOT) + ":";
    }

    /**
     * Prefix of every key of one operation kind on a table. No kind name is a prefix of another.
     */
    public static String kindPrefix(String table, OperationKind kind) {
        return tablePrefix(table) + kind.wireName();
    }

    private static String encode(Operation operation) {
        try {
            byte[] json = CANONICAL.writeValueAsString(new TreeMap<>(operation.getFilters()))
                    .getBytes(StandardCharsets.UTF_8);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Filters are not serializable: " + operation.getFilters(), e);
        }
    }
}
