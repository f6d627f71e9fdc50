package com.syncgen.schemagen;

/**
 * Base of the unrecoverable failures raised by the generation pipeline.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
