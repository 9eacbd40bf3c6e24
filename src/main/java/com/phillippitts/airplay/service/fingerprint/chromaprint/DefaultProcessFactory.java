package com.phillippitts.airplay.service.fingerprint.chromaprint;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Runs fpcalc through {@link ProcessBuilder}; stdout carries the JSON, stderr the decoder log. */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        Process process = builder.start();
        // fpcalc reads the file argument, never stdin
        process.getOutputStream().close();
        return process;
    }
}
