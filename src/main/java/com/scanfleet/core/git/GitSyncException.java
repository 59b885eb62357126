package com.scanfleet.core.git;

/**
 * The working copy could not be created.
 */
public class GitSyncException extends RuntimeException {

    public GitSyncException(String message) {
        super(message);
    }
}
