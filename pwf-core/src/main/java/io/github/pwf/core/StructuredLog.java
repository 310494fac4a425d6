package io.github.pwf.core;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Package-private helper for structured JUL logging.
/// Produces concise key=value pairs prefixed by event=NAME.
final class StructuredLog {

    private StructuredLog() {}

    static void fine(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
    }

    static void finer(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
    }

    static void severe(Logger log, String event, Throwable cause, Object... kv) {
        if (log.isLoggable(Level.SEVERE)) log.log(Level.SEVERE, cause, () -> ev(event, kv));
    }

    static String ev(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("event=").append(sanitize(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            Object key = kv[i];
            Object val = kv[i + 1];
            if (key == null) continue;
            String v = val == null ? "null" : sanitize(val.toString());
            sb.append(' ').append(key).append('=');
            // quote if contains whitespace
            if (needsQuotes(v)) sb.append('"').append(v.replace("\"", "\\\"")).append('"'); else sb.append(v);
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String s) {
        if (s.isEmpty()) return true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"') return true;
        }
        return false;
    }

    private static String sanitize(String s) {
        // Trim overly long payloads such as decoder messages with source excerpts
        final int MAX = 200;
        String trimmed = s.length() > MAX ? s.substring(0, MAX) + "..." : s;
        return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}
