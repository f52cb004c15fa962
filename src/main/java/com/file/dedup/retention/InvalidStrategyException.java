package com.file.dedup.retention;

/**
 * Thrown when a retention strategy name is not recognized.
 */
public class InvalidStrategyException extends IllegalArgumentException {

    private final String strategy;

    public InvalidStrategyException(String strategy) {
        super("Unknown retention strategy: '" + strategy + "'. Valid strategies: " + RetentionStrategy.validNames());
        this.strategy = strategy;
    }

    public String getStrategy() {
        return strategy;
    }
}
