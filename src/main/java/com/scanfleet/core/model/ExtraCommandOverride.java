package com.scanfleet.core.model;

import java.util.List;

/**
 * Per-repository override: an optional working directory (relative to the checkout) that
 * becomes the scan root, and shell commands run there before classification.
 */
public record ExtraCommandOverride(String workdir, List<String> commands) {

    public static final ExtraCommandOverride NONE = new ExtraCommandOverride(null, List.of());

    public ExtraCommandOverride {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public boolean hasWorkdir() {
        return workdir != null && !workdir.isBlank();
    }
}
