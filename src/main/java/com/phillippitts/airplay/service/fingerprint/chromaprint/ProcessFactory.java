package com.phillippitts.airplay.service.fingerprint.chromaprint;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches the fpcalc subprocess. Tests substitute a factory returning scripted processes.
 */
@FunctionalInterface
interface ProcessFactory {

    /**
     * @param command    fpcalc executable followed by its arguments
     * @param workingDir directory of the audio file, may be null
     * @throws IOException if the executable cannot be launched
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
