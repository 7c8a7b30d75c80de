package org.ctiextract;

/**
 * Base type of every error raised by the extraction engine.
 * <p>
 * All subtypes describe configuration problems (bad coordinates, mismatched grids, unknown
 * readout corners) that cannot be recovered from inside the engine. They are raised at the
 * point of detection and no operation returns a partial result alongside one.
 * <p>
 * This is a RuntimeException because callers (fitting, simulation, masking) surface these
 * errors to the operator rather than handling them.
 */
public abstract class ExtractionException extends RuntimeException {

    /**
     * Creates an ExtractionException with the specified message.
     *
     * @param message Description of the failure
     */
    protected ExtractionException(String message) {
        super(message);
    }

    /**
     * Creates an ExtractionException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    protected ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
