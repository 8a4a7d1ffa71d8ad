package org.broadinstitute.numtfinder.exceptions;

/**
 * Errors that are not the user's fault: a pipeline stage broke a guarantee the next stage depends on.
 * {@link org.broadinstitute.numtfinder.Main} reports them with a stack trace.
 */
public class NumtFinderException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public NumtFinderException(final String message) {
        super(message);
    }

    /**
     * A stage produced hits, fragments or blocks that break the ordering or overlap rules.
     */
    public static class InvariantViolation extends NumtFinderException {
        private static final long serialVersionUID = 0L;

        public InvariantViolation(final String stage, final String message) {
            super(String.format("Invariant violated after %s: %s", stage, message));
        }
    }
}
