package com.file.dedup.core.model;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * Lexical ordering of paths by their string form, used wherever output must be deterministic.
 */
public final class PathOrder {

    public static final Comparator<Path> LEXICAL = Comparator.comparing(Path::toString);

    private PathOrder() {
    }

    public static int compare(Path a, Path b) {
        return a.toString().compareTo(b.toString());
    }
}
