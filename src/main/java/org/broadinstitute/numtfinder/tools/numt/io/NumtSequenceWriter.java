package org.broadinstitute.numtfinder.tools.numt.io;

import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.Locatable;
import htsjdk.samtools.util.SequenceUtil;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.tools.numt.NumtBlock;
import org.broadinstitute.numtfinder.tools.numt.NumtFragment;
import org.broadinstitute.numtfinder.tools.numt.Strand;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Extracts NUMT fragment and block sequences from the assembly.
 *
 * Records are named {@code <SeqName>_<Start>-<End>}; the description carries the provenance.
 */
public final class NumtSequenceWriter {

    private final Map<String, ReferenceSequence> assembly;

    /**
     * @param assembly assembly sequences by name; must contain every sequence that will be written
     */
    public NumtSequenceWriter(final Map<String, ReferenceSequence> assembly) {
        this.assembly = Utils.nonNull(assembly, "assembly");
    }

    /**
     * Writes one record per fragment.
     *
     * @param reverseComplement whether minus-strand fragments are written as their reverse complement
     */
    public void writeFragments(final Path output, final Iterable<NumtFragment> fragments, final boolean reverseComplement) {
        try (final FastaReferenceWriter writer = FastaSequences.openWriter(output)) {
            for (final NumtFragment fragment : fragments) {
                final byte[] bases = extract(fragment);
                if (reverseComplement && fragment.getStrand() == Strand.MINUS) {
                    SequenceUtil.reverseComplement(bases);
                }
                final String description = String.format("frag=%d strand=%s mt=%d-%d",
                        fragment.getFragNum(), fragment.getStrand().getSymbol(),
                        fragment.getReference().getStart(), fragment.getReference().getEnd());
                writer.startSequence(recordName(fragment), description).appendBases(bases);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output.toString(), "could not write fragment FASTA", e);
        }
    }

    /** Writes one positive-strand record per block. */
    public void writeBlocks(final Path output, final Iterable<NumtBlock> blocks) {
        try (final FastaReferenceWriter writer = FastaSequences.openWriter(output)) {
            for (final NumtBlock block : blocks) {
                final String description = String.format("mtFrag=%s strand=%s", block.getMtFrag(), block.getStrand().getSymbol());
                writer.startSequence(recordName(block), description).appendBases(extract(block));
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output.toString(), "could not write block FASTA", e);
        }
    }

    /**
     * Checks that every locus lies on a sequence of the assembly, so that nothing fails once writing has started.
     *
     * @throws UserException.BadInput for the first locus that does not
     */
    public void checkWithinAssembly(final Iterable<? extends Locatable> loci) {
        Utils.nonNull(loci, "loci");
        loci.forEach(this::sequenceUnder);
    }

    static String recordName(final Locatable locus) {
        return locus.getContig() + "_" + locus.getStart() + "-" + locus.getEnd();
    }

    /** Returns a fresh copy of the bases under {@code locus}. */
    byte[] extract(final Locatable locus) {
        return Arrays.copyOfRange(sequenceUnder(locus).getBases(), locus.getStart() - 1, locus.getEnd());
    }

    private ReferenceSequence sequenceUnder(final Locatable locus) {
        final ReferenceSequence sequence = assembly.get(locus.getContig());
        if (sequence == null) {
            throw new UserException.BadInput("sequence " + locus.getContig() + " is not present in the assembly");
        }
        if (locus.getEnd() > sequence.length()) {
            throw new UserException.BadInput(String.format("%s:%d-%d lies beyond the end of %s (length %d)",
                    locus.getContig(), locus.getStart(), locus.getEnd(), sequence.getName(), sequence.length()));
        }
        return sequence;
    }
}
