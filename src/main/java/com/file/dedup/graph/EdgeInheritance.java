package com.file.dedup.graph;

/**
 * How a new file that matches a component representative is connected to the rest of that component.
 */
public enum EdgeInheritance {
    /**
     * Every other member of the matched component gets an edge carrying the
     * representative's weight, flagged as inherited.
     */
    COMPONENT,
    /**
     * Only the measured edge to the representative is added.
     */
    REPRESENTATIVE_ONLY
}
