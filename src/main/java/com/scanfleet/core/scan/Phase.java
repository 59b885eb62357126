package com.scanfleet.core.scan;

import java.util.List;

/**
 * One external command in a pipeline together with the policy applied if it fails.
 */
public record Phase(String name, List<String> command, PhasePolicy policy) {

    public Phase {
        command = List.copyOf(command);
    }

    public static Phase fatal(String name, List<String> command) {
        return new Phase(name, command, PhasePolicy.FATAL);
    }

    public static Phase tolerated(String name, List<String> command) {
        return new Phase(name, command, PhasePolicy.TOLERATED);
    }

    public static Phase fallbackOnFailure(String name, List<String> command) {
        return new Phase(name, command, PhasePolicy.FALLBACK_ON_FAILURE);
    }
}
