package org.macroweave.junit.extensions.logging;

/**
 * Levels the log watch understands. Anything below INFO is never checked.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
