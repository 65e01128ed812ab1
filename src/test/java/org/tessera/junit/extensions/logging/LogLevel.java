package org.tessera.junit.extensions.logging;

/**
 * The log levels the {@link LogWatchExtension} checks.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
