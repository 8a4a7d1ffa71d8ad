package org.broadinstitute.numtfinder.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * Errors the user can fix: missing or malformed inputs, unwritable outputs, unknown tools.
 * {@link org.broadinstitute.numtfinder.Main} reports them without a stack trace.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String message) {
        super(message);
    }

    public UserException(final String message, final Throwable cause) {
        super(message, cause);
    }

    static String describe(final Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * An input file is missing, empty or cannot be read.
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String reason) {
            super(String.format("Couldn't read %s: %s", file.toAbsolutePath(), reason));
        }

        public CouldNotReadInputFile(final Path file, final Exception cause) {
            super(String.format("Couldn't read %s: %s", file.toAbsolutePath(), describe(cause)), cause);
        }
    }

    /**
     * An output file cannot be created or written.
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final Exception cause) {
            this(file.getAbsolutePath(), "write failed", cause);
        }

        public CouldNotCreateOutputFile(final String file, final String what, final Exception cause) {
            super(String.format("Couldn't write %s (%s): %s", file, what, describe(cause)), cause);
        }
    }

    /**
     * The mitochondrial reference FASTA holds no usable sequence.
     */
    public static class MissingReference extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingReference(final String message) {
            super(message);
        }
    }

    /**
     * Input content that breaks the expected format or the coordinate rules of hits.
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }
    }
}
