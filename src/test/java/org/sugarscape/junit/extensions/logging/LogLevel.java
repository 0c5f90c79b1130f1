package org.sugarscape.junit.extensions.logging;

/**
 * Levels a test can allow, expect or fail on.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
