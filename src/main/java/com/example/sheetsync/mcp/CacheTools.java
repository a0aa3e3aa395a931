package com.example.sheetsync.mcp;

import com.example.sheetsync.cache.CacheKeys;
import com.example.sheetsync.cache.CacheStats;
import com.example.sheetsync.cache.CacheStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
public class CacheTools {

    private final CacheStore cacheStore;

    public CacheTools(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @Tool(description = "Get cache hit, miss, eviction and size counters")
    public CacheStats cache_stats() {
        return cacheStore.stats();
    }

    @Tool(description = "Drop cached reads of one table, or of every table when table is empty")
    public Map<String, Object> cache_invalidate(String table) {
        Map<String, Object> result = new HashMap<>();
        if (table == null || table.isBlank()) {
            cacheStore.clear();
            result.put("cleared", true);
        } else {
            result.put("removed", cacheStore.invalidatePrefix(CacheKeys.tablePrefix(table)));
        }
        result.put("ok", true);
        return result;
    }
}
