package com.phillippitts.pingwatch.service.process;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of command-based
 * probes and traces.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a
 * fake {@link Process} with controlled output, exit code and lifetime.
 */
@FunctionalInterface
public interface ProcessFactory {
    /**
     * Starts a new process with the given command.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;
}
