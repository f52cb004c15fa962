package com.file.dedup.api;

import java.util.Locale;

/**
 * What happens to the non-keeper members of each group.
 */
public enum ConsolidationMode {
    /** Relocate into the holding area, transactionally per group. */
    MOVE,
    /** Delete outright. Deleted files cannot be restored. */
    DELETE,
    /** Plan only; nothing on disk changes. */
    REPORT;

    public static ConsolidationMode fromName(String name) {
        if (name != null) {
            for (ConsolidationMode mode : values()) {
                if (mode.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown mode: '" + name + "'. Valid modes: move, delete, report");
    }
}
