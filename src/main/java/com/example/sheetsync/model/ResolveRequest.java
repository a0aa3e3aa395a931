package com.example.sheetsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolveRequest {
    private ResolutionStrategy strategy;
    /** Required for {@link ResolutionStrategy#MERGE}. */
    private Map<String, Object> mergedData;
    private String resolvedBy;
}
