package com.file.dedup.retention;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Criterion used to choose the keeper of a duplicate group when no priority pattern applies.
 */
public enum RetentionStrategy {
    NEWEST("newest"),
    OLDEST("oldest"),
    LARGEST("largest"),
    SMALLEST("smallest"),
    SHORTEST_RELATIVE_PATH("shortest-relative-path", "shortest_path", "shortest-path");

    private final List<String> names;

    RetentionStrategy(String... names) {
        this.names = List.of(names);
    }

    /**
     * The canonical name, as accepted on the command line.
     */
    public String canonicalName() {
        return names.get(0);
    }

    /**
     * Looks up a strategy by name or alias, ignoring case.
     *
     * @throws InvalidStrategyException if the name is unknown
     */
    public static RetentionStrategy fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (RetentionStrategy strategy : values()) {
                if (strategy.names.contains(key)) {
                    return strategy;
                }
            }
        }
        throw new InvalidStrategyException(name);
    }

    static String validNames() {
        return Arrays.stream(values())
                .flatMap(s -> s.names.stream())
                .collect(Collectors.joining(", "));
    }
}
