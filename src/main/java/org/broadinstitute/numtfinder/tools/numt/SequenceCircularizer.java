package org.broadinstitute.numtfinder.tools.numt;

import htsjdk.samtools.reference.ReferenceSequence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.utils.Utils;

/**
 * Builds the sequence the aligner searches: a circular reference is written twice in a row, so an alignment
 * running across the origin is reported as one hit rather than split in two.
 */
public final class SequenceCircularizer {
    private static final Logger logger = LogManager.getLogger(SequenceCircularizer.class);

    public static final String DOUBLED_NAME_SUFFIX = "2X";

    private final boolean circular;

    public SequenceCircularizer(final boolean circular) {
        this.circular = circular;
    }

    public boolean isCircular() {
        return circular;
    }

    /**
     * @return {@code bases + bases} named {@code <name>2X} for a circular reference, otherwise the input unchanged.
     * @throws UserException.MissingReference if the reference has no bases.
     */
    public ReferenceSequence circularize(final ReferenceSequence reference) {
        checkNotEmpty(reference);
        if (!circular) {
            logger.info(String.format("Using %s as search reference unchanged (linear)", reference.getName()));
            return reference;
        }
        final byte[] bases = reference.getBases();
        final byte[] doubled = new byte[2 * bases.length];
        System.arraycopy(bases, 0, doubled, 0, bases.length);
        System.arraycopy(bases, 0, doubled, bases.length, bases.length);
        logger.info(String.format("Doubled circular reference %s: %d bp -> %d bp", reference.getName(), bases.length, doubled.length));
        return new ReferenceSequence(reference.getName() + DOUBLED_NAME_SUFFIX, reference.getContigIndex(), doubled);
    }

    /**
     * @return the coordinate system relating search positions on the circularized reference to the true reference.
     */
    public CircularCoordinates coordinatesFor(final ReferenceSequence reference) {
        checkNotEmpty(reference);
        return new CircularCoordinates(reference.length(), circular);
    }

    private static void checkNotEmpty(final ReferenceSequence reference) {
        Utils.nonNull(reference, "reference");
        if (reference.getBases() == null || reference.length() == 0) {
            throw new UserException.MissingReference("Mitochondrial reference " + reference.getName() + " has no bases");
        }
    }
}
