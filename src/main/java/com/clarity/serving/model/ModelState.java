package com.clarity.serving.model;

/**
 * Lifecycle state of a registered model version.
 *
 * Transitions:
 * - NOT_LOADED -> LOADING -> AVAILABLE | ERROR
 * - ERROR -> LOADING (retry on next request)
 * - AVAILABLE -> UNLOADING -> NOT_LOADED (unload)
 * - AVAILABLE -> UNLOADING -> LOADING -> AVAILABLE | ERROR (reload)
 */
public enum ModelState {
    NOT_LOADED,
    LOADING,
    AVAILABLE,
    ERROR,
    UNLOADING
}
