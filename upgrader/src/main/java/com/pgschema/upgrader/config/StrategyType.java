package com.pgschema.upgrader.config;

import com.pgschema.upgrader.exception.ConfigurationException;

/**
 * Execution strategy selected for the command line application.
 */
public enum StrategyType {
    REACTIVE,
    BLOCKING;

    public static StrategyType fromString(String value) {
        for (StrategyType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ConfigurationException(
            "Unknown strategy: " + value + " (expected reactive or blocking)");
    }
}
