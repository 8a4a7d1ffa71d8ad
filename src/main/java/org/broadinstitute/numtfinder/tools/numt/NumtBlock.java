package org.broadinstitute.numtfinder.tools.numt;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fragments of one assembly sequence merged by proximity.
 * <p>
 * {@code fragLen} sums the assembly spans of the members and {@code fragGaps} sums the gaps between
 * consecutive members, so the block span is their sum. {@code length} and {@code identity} sum the
 * members' aligned lengths and identical bases.
 * </p>
 */
public final class NumtBlock implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;

    public static final String FRAG_NUM_SEPARATOR = "|";

    private final SimpleInterval interval;
    private final BlockStrand strand;
    private final List<Integer> fragNums;
    private final long fragLen;
    private final long fragGaps;
    private final double bitScore;
    private final double expect;
    private final long length;
    private final long identity;

    public NumtBlock(final SimpleInterval interval, final BlockStrand strand, final List<Integer> fragNums,
                     final long fragLen, final long fragGaps, final double bitScore, final double expect,
                     final long length, final long identity) {
        this.interval = Utils.nonNull(interval, "interval");
        this.strand = Utils.nonNull(strand, "strand");
        Utils.nonNull(fragNums, "fragNums");
        Utils.validateArg(!fragNums.isEmpty(), "A block needs at least one fragment");
        this.fragNums = Collections.unmodifiableList(new ArrayList<>(fragNums));
        this.fragLen = fragLen;
        this.fragGaps = fragGaps;
        this.bitScore = bitScore;
        this.expect = expect;
        this.length = length;
        this.identity = identity;
    }

    public SimpleInterval getInterval() {
        return interval;
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

    public BlockStrand getStrand() {
        return strand;
    }

    /** Member fragment numbers in merge order. */
    public List<Integer> getFragNums() {
        return fragNums;
    }

    public int getFragCount() {
        return fragNums.size();
    }

    /** Member fragment numbers joined with {@value #FRAG_NUM_SEPARATOR}. */
    public String getMtFrag() {
        return fragNums.stream().map(String::valueOf).collect(Collectors.joining(FRAG_NUM_SEPARATOR));
    }

    public long getFragLen() {
        return fragLen;
    }

    public long getFragGaps() {
        return fragGaps;
    }

    public double getBitScore() {
        return bitScore;
    }

    public double getExpect() {
        return expect;
    }

    public long getLength() {
        return length;
    }

    public long getIdentity() {
        return identity;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final NumtBlock that = (NumtBlock) o;
        return fragLen == that.fragLen && fragGaps == that.fragGaps &&
                Double.compare(that.bitScore, bitScore) == 0 && Double.compare(that.expect, expect) == 0 &&
                length == that.length && identity == that.identity &&
                interval.equals(that.interval) && strand == that.strand && fragNums.equals(that.fragNums);
    }

    @Override
    public int hashCode() {
        int result = interval.hashCode();
        result = 31 * result + strand.hashCode();
        result = 31 * result + fragNums.hashCode();
        result = 31 * result + Long.hashCode(fragLen);
        result = 31 * result + Long.hashCode(fragGaps);
        return result;
    }

    @Override
    public String toString() {
        return "NumtBlock{" + interval + " " + strand + " frags=" + getMtFrag() + " gaps=" + fragGaps + "}";
    }
}
