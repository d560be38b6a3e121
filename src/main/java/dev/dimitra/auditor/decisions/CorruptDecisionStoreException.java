package dev.dimitra.auditor.decisions;

import java.io.IOException;
import java.nio.file.Path;

/** A decision store line could not be read. Suppression cannot be trusted, so loading stops. */
public class CorruptDecisionStoreException extends IOException {

    private final Path path;
    private final int lineNumber;

    public CorruptDecisionStoreException(Path path, int lineNumber, String problem, Throwable cause) {
        super(path + ":" + lineNumber + ": " + problem, cause);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public Path path() {
        return path;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
