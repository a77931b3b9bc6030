package org.opentimeline.resolve;

/** Thrown when the requested root timeline does not exist. */
public class TimelineNotFoundException extends ResolutionException {

    public TimelineNotFoundException(String idOrName) {
        super(idOrName, "Timeline not found: " + idOrName);
    }
}
