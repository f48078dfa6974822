package de.upb.sse.jrefactor.exceptions;

import java.nio.file.Path;

public class SourceParseException extends RuntimeException {
    private final Path sourcePath;

    public SourceParseException(Path sourcePath, String message) {
        super(sourcePath + ": " + message);
        this.sourcePath = sourcePath;
    }

    public SourceParseException(Path sourcePath, String message, Throwable cause) {
        super(sourcePath + ": " + message, cause);
        this.sourcePath = sourcePath;
    }

    public Path getSourcePath() {
        return sourcePath;
    }
}
