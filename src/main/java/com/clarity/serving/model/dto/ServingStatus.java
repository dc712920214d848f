package com.clarity.serving.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate serving health.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServingStatus {

    /**
     * All critical models are available.
     */
    private boolean ready;

    private String activeModelId;
    private String activeVersion;
    private List<ModelStatus> models;
    private CacheStatistics cache;
    private long pendingRequests;
}
