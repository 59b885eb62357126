package com.scanfleet.core.model;

/**
 * Which branch {@code ensureProject} took on the analysis server.
 */
public enum RegistrationResult {
    CREATED,
    EXISTING
}
