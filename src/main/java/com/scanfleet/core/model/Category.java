package com.scanfleet.core.model;

/**
 * Coarse kind of repository, derived from a single walk of its file tree.
 */
public enum Category {
    CODE,
    CONFIG,
    PERFORMANCE_TEST,
    EMPTY
}
