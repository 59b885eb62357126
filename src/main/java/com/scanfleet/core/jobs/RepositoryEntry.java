package com.scanfleet.core.jobs;

/**
 * One parsed {@code prefix,url} line of the repository list.
 */
public record RepositoryEntry(String prefix, String url, String name, int lineNumber) {}
