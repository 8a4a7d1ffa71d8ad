package org.broadinstitute.numtfinder.tools.numt;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Serializable;

/**
 * A surviving alignment hit with its reference coordinates projected onto the true reference
 * and a run-unique fragment number.
 */
public final class NumtFragment implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;

    private final int fragNum;
    private final AlignmentHit hit;
    private final ReferenceInterval reference;

    public NumtFragment(final int fragNum, final AlignmentHit hit, final ReferenceInterval reference) {
        Utils.validateArg(fragNum > 0, () -> "Fragment numbers start at 1 but got " + fragNum);
        this.fragNum = fragNum;
        this.hit = Utils.nonNull(hit, "hit");
        this.reference = Utils.nonNull(reference, "reference");
        Utils.validateArg(reference.getSpace() == CoordinateSpace.TRUE, "Fragment reference coordinates must be projected");
    }

    public int getFragNum() {
        return fragNum;
    }

    /** Projected interval on the true reference; may wrap the origin. */
    public ReferenceInterval getReference() {
        return reference;
    }

    public boolean isWrapped() {
        return reference.isWrapped();
    }

    @Override
    public String getContig() {
        return hit.getContig();
    }

    @Override
    public int getStart() {
        return hit.getStart();
    }

    @Override
    public int getEnd() {
        return hit.getEnd();
    }

    /** @return number of assembly bases spanned. */
    public int getSpan() {
        return hit.getInterval().size();
    }

    public Strand getStrand() {
        return hit.getStrand();
    }

    public double getBitScore() {
        return hit.getBitScore();
    }

    public double getExpect() {
        return hit.getExpect();
    }

    public int getAlignedLength() {
        return hit.getAlignedLength();
    }

    public int getIdentity() {
        return hit.getIdentity();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final NumtFragment that = (NumtFragment) o;
        return fragNum == that.fragNum && hit.equals(that.hit) && reference.equals(that.reference);
    }

    @Override
    public int hashCode() {
        int result = fragNum;
        result = 31 * result + hit.hashCode();
        result = 31 * result + reference.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "NumtFragment{" + fragNum + " " + hit.getInterval() + " " + getStrand() + " mt=" + reference + "}";
    }
}
