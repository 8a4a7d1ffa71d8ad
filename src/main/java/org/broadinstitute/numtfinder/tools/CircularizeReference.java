package org.broadinstitute.numtfinder.tools;

import htsjdk.samtools.reference.ReferenceSequence;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.numtfinder.cmdline.CommandLineProgram;
import org.broadinstitute.numtfinder.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.numtfinder.cmdline.programgroups.MitochondrialProgramGroup;
import org.broadinstitute.numtfinder.tools.numt.SequenceCircularizer;
import org.broadinstitute.numtfinder.tools.numt.io.FastaSequences;

import java.io.File;
import java.util.Collections;

/**
 * Writes the doubled mitochondrial reference to search the assembly with.
 *
 * <p>The first sequence of the input FASTA is written twice in a row under the name {@code <name>2X}. Aligning
 * this sequence rather than the reference itself keeps hits that run across the origin of the circular genome in
 * one piece; {@link FindNumts} maps their coordinates back.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * numtfinder CircularizeReference \
 *   -R chrM.fasta \
 *   -O chrM2X.fasta
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Writes a circular mitochondrial reference twice in a row, the sequence to align against a genome " +
                "assembly before running FindNumts",
        oneLineSummary = "Doubles a circular mitochondrial reference for alignment",
        programGroup = MitochondrialProgramGroup.class
)
@DocumentedFeature
public final class CircularizeReference extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.REFERENCE_LONG_NAME,
            shortName = StandardArgumentDefinitions.REFERENCE_SHORT_NAME,
            doc = "Mitochondrial reference FASTA; only the first sequence is used")
    public File reference;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output FASTA for the doubled reference")
    public File output;

    @Override
    protected Object doWork() {
        final ReferenceSequence mito = FastaSequences.readMitochondrialReference(reference.toPath(), true);
        final ReferenceSequence doubled = new SequenceCircularizer(true).circularize(mito);
        FastaSequences.write(output.toPath(), Collections.singletonList(doubled));
        logger.info(String.format("Wrote %s (%d bp) to %s", doubled.getName(), doubled.length(), output));
        return doubled.getName();
    }
}
