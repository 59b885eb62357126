package com.scanfleet.core.process;

/**
 * An external command could not be driven to completion (I/O failure or interruption).
 */
public class CommandExecutionException extends RuntimeException {

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
