package org.ppvariant.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level field of console output: errors red,
 * warnings yellow, everything else unchanged. Coloring is skipped when the
 * {@code NO_COLOR} environment variable is set.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final boolean enabled = System.getenv("NO_COLOR") == null;

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            default -> in;
        };
    }
}
