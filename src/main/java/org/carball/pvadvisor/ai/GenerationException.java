package org.carball.pvadvisor.ai;

/**
 * Raised by a {@link GenerationClient} when no usable text payload could be obtained.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
