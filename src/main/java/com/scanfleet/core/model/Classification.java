package com.scanfleet.core.model;

import java.util.Set;

/**
 * Result of classifying a repository checkout: its {@link Category} plus descriptive tags
 * such as {@code yaml} or {@code terraform}. Computed once per job and never re-derived.
 */
public record Classification(Category category, Set<String> tags) {

    public static final String TAG_YAML = "yaml";
    public static final String TAG_TERRAFORM = "terraform";

    public Classification {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static Classification of(Category category) {
        return new Classification(category, Set.of());
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
