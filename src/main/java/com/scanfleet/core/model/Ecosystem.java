package com.scanfleet.core.model;

/**
 * Language/build-tool family that decides which build, test and scan pipeline a
 * {@link Category#CODE} repository goes through.
 */
public enum Ecosystem {
    JAVA,
    DOTNET,
    PYTHON,
    GO,
    GENERIC
}
