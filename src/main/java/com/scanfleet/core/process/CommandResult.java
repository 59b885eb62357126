package com.scanfleet.core.process;

/**
 * Exit status of an external command plus the tail of its (masked) output.
 */
public record CommandResult(int exitCode, String outputTail) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
