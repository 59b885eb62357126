package com.scanfleet.core.jobs;

/**
 * URL normalisation and name derivation for repository-list entries.
 */
public final class RepositoryUrls {

    private static final String GITHUB_HTTPS = "https://github.com/";
    private static final String BITBUCKET_HTTPS = "https://bitbucket.org/";

    private RepositoryUrls() {}

    public static String normalize(String url) {
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Rewrites GitHub and Bitbucket HTTPS URLs to their SSH form; other URLs are returned unchanged.
     */
    public static String toSsh(String url) {
        String normalized = normalize(url);
        if (normalized.startsWith(GITHUB_HTTPS)) {
            return "git@github.com:" + normalized.substring(GITHUB_HTTPS.length());
        }
        if (normalized.startsWith(BITBUCKET_HTTPS)) {
            return "git@bitbucket.org:" + normalized.substring(BITBUCKET_HTTPS.length());
        }
        return normalized;
    }

    /**
     * Last path segment with {@code .git} and {@code /browse} removed.
     */
    public static String repositoryName(String url) {
        String normalized = normalize(url);
        if (normalized.endsWith("/browse")) {
            normalized = normalized.substring(0, normalized.length() - "/browse".length());
        }
        int slash = Math.max(normalized.lastIndexOf('/'), normalized.lastIndexOf(':'));
        String name = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - ".git".length());
        }
        return name;
    }
}
