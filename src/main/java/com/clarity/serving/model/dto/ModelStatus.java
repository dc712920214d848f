package com.clarity.serving.model.dto;

import com.clarity.serving.model.ModelState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a registered model version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStatus {

    private String modelId;
    private String version;
    private ModelState state;
    private boolean critical;
    private boolean active;
    private boolean optimized;
    private Duration loadTime;
    private Instant loadedAt;
    private String errorMessage;
}
