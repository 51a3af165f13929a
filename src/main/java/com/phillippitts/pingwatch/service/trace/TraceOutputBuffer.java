package com.phillippitts.pingwatch.service.trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered output lines of one traced address.
 *
 * <p>Not thread-safe on its own: {@link TraceSession} guards every access with its lock.
 */
final class TraceOutputBuffer {

    private final List<String> lines = new ArrayList<>();

    void append(String line) {
        lines.add(line);
    }

    List<String> lines() {
        return List.copyOf(lines);
    }

    String text() {
        return String.join(System.lineSeparator(), lines);
    }
}
