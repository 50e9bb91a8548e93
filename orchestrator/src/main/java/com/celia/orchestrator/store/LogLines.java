package com.celia.orchestrator.store;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Formats job log lines as {@code [HH:mm:ss] message\n} and cuts log tails
 * for summaries and reports.
 */
public final class LogLines {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private LogLines() {}

    public static String format(Clock clock, String message) {
        String time = TIME.format(clock.instant().atZone(clock.getZone()));
        return "[" + time + "] " + (message == null ? "" : message.stripTrailing()) + "\n";
    }

    /** Last {@code maxChars} characters of the log; empty for a null log. */
    public static String tail(String logs, int maxChars) {
        if (logs == null) return "";
        return logs.length() <= maxChars ? logs : logs.substring(logs.length() - maxChars);
    }
}
