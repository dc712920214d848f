package com.clarity.serving.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached analysis wrapper for the result store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedAnalysis {

    private AnalysisResult result;

    /**
     * When this entry was written; validity is measured from here.
     */
    private Instant createdAt;
}
