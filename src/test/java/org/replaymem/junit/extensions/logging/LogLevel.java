package org.replaymem.junit.extensions.logging;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
