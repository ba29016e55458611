package com.phillippitts.truthtell.service.audio;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // stdout carries audio, stderr carries progress; read separately
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
