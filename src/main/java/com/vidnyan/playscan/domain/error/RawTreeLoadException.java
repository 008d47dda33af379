package com.vidnyan.playscan.domain.error;

import java.nio.file.Path;

/**
 * A script file could not be read or is not valid YAML.
 */
public class RawTreeLoadException extends AnalysisException {

    private final Path file;

    public RawTreeLoadException(Path file, String reason, Throwable cause) {
        super("Failed to load " + file + ": " + reason, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
