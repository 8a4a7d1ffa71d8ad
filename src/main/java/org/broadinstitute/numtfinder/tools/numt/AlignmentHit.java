package org.broadinstitute.numtfinder.tools.numt;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Serializable;
import java.util.Objects;

/**
 * One local alignment between the search reference and an assembly sequence, as reported by the aligner.
 * <p>
 * Assembly coordinates are always ascending; orientation is carried by {@link #getStrand()}. The reference
 * interval is in {@link CoordinateSpace#DOUBLED} space.
 * </p>
 */
public final class AlignmentHit implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;

    private final SimpleInterval interval;
    private final Strand strand;
    private final double bitScore;
    private final double expect;
    private final int alignedLength;
    private final int identity;
    private final ReferenceInterval reference;

    /**
     * @param interval assembly interval, the contig being the assembly sequence id
     * @param alignedLength alignment length, gaps included
     * @param identity number of identical aligned bases
     * @param reference interval on the searched (doubled) reference
     */
    public AlignmentHit(final SimpleInterval interval, final Strand strand, final double bitScore, final double expect,
                        final int alignedLength, final int identity, final ReferenceInterval reference) {
        this.interval = Utils.nonNull(interval, "interval");
        this.strand = Utils.nonNull(strand, "strand");
        this.reference = Utils.nonNull(reference, "reference");
        Utils.validateArg(reference.getSpace() == CoordinateSpace.DOUBLED, "Alignment reference coordinates must be in the searched space");
        Utils.validateArg(alignedLength > 0, () -> "Alignment length must be positive: " + alignedLength);
        Utils.validateArg(identity >= 0 && identity <= alignedLength,
                () -> String.format("Identity %d must lie between 0 and the alignment length %d", identity, alignedLength));
        Utils.validateArg(expect >= 0, () -> "Expect value must not be negative: " + expect);
        this.bitScore = bitScore;
        this.expect = expect;
        this.alignedLength = alignedLength;
        this.identity = identity;
    }

    public SimpleInterval getInterval() {
        return interval;
    }

    public String getSequenceName() {
        return interval.getContig();
    }

    @Override
    public String getContig() {
        return interval.getContig();
    }

    @Override
    public int getStart() {
        return interval.getStart();
    }

    @Override
    public int getEnd() {
        return interval.getEnd();
    }

    public Strand getStrand() {
        return strand;
    }

    public double getBitScore() {
        return bitScore;
    }

    public double getExpect() {
        return expect;
    }

    public int getAlignedLength() {
        return alignedLength;
    }

    public int getIdentity() {
        return identity;
    }

    public ReferenceInterval getReference() {
        return reference;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AlignmentHit that = (AlignmentHit) o;
        return Double.compare(that.bitScore, bitScore) == 0 &&
                Double.compare(that.expect, expect) == 0 &&
                alignedLength == that.alignedLength &&
                identity == that.identity &&
                interval.equals(that.interval) &&
                strand == that.strand &&
                reference.equals(that.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, strand, bitScore, expect, alignedLength, identity, reference);
    }

    @Override
    public String toString() {
        return String.format("AlignmentHit{%s %s ref=%s identity=%d/%d}", interval, strand, reference, identity, alignedLength);
    }
}
