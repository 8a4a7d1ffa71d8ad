package org.broadinstitute.numtfinder.cmdline;

/**
 * Argument names shared by more than one tool, so that the same input has the same name everywhere.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions() {}

    public static final String REFERENCE_LONG_NAME = "reference";
    public static final String REFERENCE_SHORT_NAME = "R";

    public static final String OUTPUT_LONG_NAME = "output";
    public static final String OUTPUT_SHORT_NAME = "O";

    /** Short name of the main input of a tool; its long name is tool specific. */
    public static final String INPUT_SHORT_NAME = "I";

    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
}
