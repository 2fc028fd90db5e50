package org.prossme.bpmn.autolayout.bpmn;

/**
 * Raised when structural input cannot be laid out: a reference that does not resolve, an id
 * used twice in one scope, or markup that does not decode into the process model at all.
 * Always fatal for the request; the input is never repaired.
 */
public class StructuralException extends RuntimeException {

    public enum Reason {
        DANGLING_REFERENCE,
        DUPLICATE_ID,
        UNDECODABLE
    }

    private final Reason reason;

    public StructuralException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StructuralException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
