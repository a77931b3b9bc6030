package org.opentimeline.resolve;

/**
 * Base of every failure that stops a timeline from being rendered. Each subtype is
 * attributable to one timeline and is a deterministic outcome of the data, so none
 * of them is worth retrying.
 */
public abstract class ResolutionException extends RuntimeException {

    private final String timelineId;

    protected ResolutionException(String timelineId, String message) {
        super(message);
        this.timelineId = timelineId;
    }

    protected ResolutionException(String timelineId, String message, Throwable cause) {
        super(message, cause);
        this.timelineId = timelineId;
    }

    /** The timeline the failure is attributed to. */
    public String timelineId() {
        return timelineId;
    }
}
