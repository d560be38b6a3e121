package dev.dimitra.auditor.llm;

import java.io.IOException;

/** The judge answered, but not with a valid findings object. */
public class MalformedResponseException extends IOException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
