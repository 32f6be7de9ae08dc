package org.ifjc.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level column of console output.
 *
 * <p>ERROR is bold red, WARN yellow, INFO green, DEBUG cyan, TRACE unchanged.
 * Set the {@code NO_COLOR} environment variable to disable coloring.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_RED = "\u001B[1;31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final boolean enabled = System.getenv("NO_COLOR") == null;

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        String color = colorOf(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_BOLD_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_GREEN;
            case Level.DEBUG_INT -> ANSI_CYAN;
            default -> null;
        };
    }
}
