package com.phillippitts.pingwatch.service.process;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 *
 * <p>stderr is merged into stdout: diagnostics from {@code traceroute} and {@code ping}
 * belong in the same transcript as their regular output.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        return pb.start();
    }
}
