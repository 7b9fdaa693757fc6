package com.receptor.normalizer.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Deprecated or alias symbols mapped to the currently valid gene name.
 */
public final class SynonymTable {

    private static final SynonymTable EMPTY = new SynonymTable(Map.of());

    private final Map<String, String> entries;

    public SynonymTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static SynonymTable empty() {
        return EMPTY;
    }

    public Optional<String> resolve(String alias) {
        return Optional.ofNullable(entries.get(alias));
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
