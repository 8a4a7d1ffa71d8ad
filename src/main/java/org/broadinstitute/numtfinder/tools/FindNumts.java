package org.broadinstitute.numtfinder.tools;

import htsjdk.samtools.reference.ReferenceSequence;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.numtfinder.cmdline.CommandLineProgram;
import org.broadinstitute.numtfinder.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.numtfinder.cmdline.argumentcollections.NumtFinderArgumentCollection;
import org.broadinstitute.numtfinder.cmdline.programgroups.MitochondrialProgramGroup;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.tools.numt.AlignmentHit;
import org.broadinstitute.numtfinder.tools.numt.CircularCoordinates;
import org.broadinstitute.numtfinder.tools.numt.NumtBlock;
import org.broadinstitute.numtfinder.tools.numt.NumtFinderEngine;
import org.broadinstitute.numtfinder.tools.numt.NumtFinderResult;
import org.broadinstitute.numtfinder.tools.numt.NumtFragment;
import org.broadinstitute.numtfinder.tools.numt.SequenceCircularizer;
import org.broadinstitute.numtfinder.tools.numt.io.CoverageDepthTableWriter;
import org.broadinstitute.numtfinder.tools.numt.io.CoverageSummaryTableWriter;
import org.broadinstitute.numtfinder.tools.numt.io.ExclusionList;
import org.broadinstitute.numtfinder.tools.numt.io.FastaSequences;
import org.broadinstitute.numtfinder.tools.numt.io.HitTableFormat;
import org.broadinstitute.numtfinder.tools.numt.io.NumtBlockTableWriter;
import org.broadinstitute.numtfinder.tools.numt.io.NumtFragmentTableWriter;
import org.broadinstitute.numtfinder.tools.numt.io.NumtSequenceWriter;
import org.broadinstitute.numtfinder.tools.numt.io.SelfHitTableWriter;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds nuclear mitochondrial fragments (NUMTs) in a genome assembly from the hits of a mitochondrial reference
 * aligned against it.
 *
 * <p>Overlapping hits on each assembly sequence are reduced to a non-overlapping set, projected back onto the
 * circular reference, cleared of sequences that are copies of the mitochondrion itself and merged into blocks of
 * nearby fragments. The coverage of the reference by the remaining fragments is reported position by position.</p>
 *
 * <p>The hits are those of the doubled reference written by {@link CircularizeReference} (or of the reference
 * itself with {@code --circular false}), either as a NUMTFinder hit table or as BLAST+ {@code -outfmt 6} output.</p>
 *
 * <h3>Outputs</h3>
 * <ul>
 *     <li>{@code <prefix>.numtfrag.tsv}: one row per NUMT fragment</li>
 *     <li>{@code <prefix>.numtblock.tsv}: fragments merged into blocks, warnings as leading comment lines</li>
 *     <li>{@code <prefix>.depthplot.tsv} and {@code <prefix>.coverage.tsv}: reference coverage</li>
 *     <li>{@code <prefix>.selfhits.tsv}: sequences called as copies of the reference</li>
 *     <li>{@code <prefix>.exclude.txt}: excluded sequences, reusable with {@code --exclude}</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * numtfinder FindNumts \
 *   --hits assembly.chrM2X.blast.tsv \
 *   --hits-format BLAST_TABULAR \
 *   -R chrM.fasta \
 *   --assembly assembly.fasta \
 *   --fragment-fasta \
 *   --output-prefix assembly.numts
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Reduces alignment hits of a mitochondrial reference against a genome assembly to NUMT fragments and " +
                "blocks, and reports the coverage of the reference by them",
        oneLineSummary = "Finds nuclear mitochondrial fragments (NUMTs) in a genome assembly",
        programGroup = MitochondrialProgramGroup.class
)
@DocumentedFeature
public final class FindNumts extends CommandLineProgram {

    public static final String HITS_LONG_NAME = "hits";
    public static final String HITS_FORMAT_LONG_NAME = "hits-format";
    public static final String ASSEMBLY_LONG_NAME = "assembly";
    public static final String OUTPUT_PREFIX_LONG_NAME = "output-prefix";
    public static final String FRAGMENT_FASTA_LONG_NAME = "fragment-fasta";
    public static final String FRAGMENT_REVCOMP_LONG_NAME = "fragment-revcomp";
    public static final String BLOCK_FASTA_LONG_NAME = "block-fasta";
    public static final String CIRCULARIZED_OUTPUT_LONG_NAME = "circularized-output";

    public static final String DEFAULT_OUTPUT_PREFIX = "numtfinder";
    public static final String FRAGMENT_TABLE_SUFFIX = ".numtfrag.tsv";
    public static final String BLOCK_TABLE_SUFFIX = ".numtblock.tsv";
    public static final String DEPTH_TABLE_SUFFIX = ".depthplot.tsv";
    public static final String COVERAGE_TABLE_SUFFIX = ".coverage.tsv";
    public static final String SELF_HIT_TABLE_SUFFIX = ".selfhits.tsv";
    public static final String EXCLUSION_LIST_SUFFIX = ".exclude.txt";
    public static final String FRAGMENT_FASTA_SUFFIX = ".fragments.fasta";
    public static final String BLOCK_FASTA_SUFFIX = ".blocks.fasta";

    @Argument(fullName = HITS_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Alignment hits of the (doubled) mitochondrial reference against the assembly")
    public File hits;

    @Argument(fullName = HITS_FORMAT_LONG_NAME,
            doc = "Layout of the hit file",
            optional = true)
    public HitTableFormat hitsFormat = HitTableFormat.TABLE;

    @Argument(fullName = StandardArgumentDefinitions.REFERENCE_LONG_NAME,
            shortName = StandardArgumentDefinitions.REFERENCE_SHORT_NAME,
            doc = "Mitochondrial reference FASTA, not doubled; only the first sequence is used")
    public File reference;

    @Argument(fullName = ASSEMBLY_LONG_NAME,
            doc = "Assembly FASTA the hits were found in. Required for FASTA output only.",
            optional = true)
    public File assembly = null;

    @Argument(fullName = OUTPUT_PREFIX_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Prefix, possibly with a directory, of every output file",
            optional = true)
    public String outputPrefix = DEFAULT_OUTPUT_PREFIX;

    @Argument(fullName = FRAGMENT_FASTA_LONG_NAME,
            doc = "Write the sequence of every fragment to <prefix>" + FRAGMENT_FASTA_SUFFIX,
            optional = true)
    public boolean fragmentFasta = false;

    @Argument(fullName = FRAGMENT_REVCOMP_LONG_NAME,
            doc = "Write minus-strand fragments as their reverse complement",
            optional = true)
    public boolean fragmentRevcomp = true;

    @Argument(fullName = BLOCK_FASTA_LONG_NAME,
            doc = "Write the positive-strand sequence of every block to <prefix>" + BLOCK_FASTA_SUFFIX,
            optional = true)
    public boolean blockFasta = false;

    @Argument(fullName = CIRCULARIZED_OUTPUT_LONG_NAME,
            doc = "Also write the reference as searched (doubled when circular) to this FASTA",
            optional = true)
    public File circularizedOutput = null;

    @ArgumentCollection
    public NumtFinderArgumentCollection numtArguments = new NumtFinderArgumentCollection();

    @Override
    protected String[] customCommandLineValidation() {
        try {
            numtArguments.validate();
        } catch (final IllegalArgumentException e) {
            return new String[]{e.getMessage()};
        }
        if ((fragmentFasta || blockFasta) && assembly == null) {
            return new String[]{"--" + ASSEMBLY_LONG_NAME + " is required with --" + FRAGMENT_FASTA_LONG_NAME +
                    " or --" + BLOCK_FASTA_LONG_NAME};
        }
        if (outputPrefix.isEmpty()) {
            return new String[]{"--" + OUTPUT_PREFIX_LONG_NAME + " must not be empty"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final ReferenceSequence mito = FastaSequences.readMitochondrialReference(reference.toPath(), numtArguments.circular);
        final SequenceCircularizer circularizer = new SequenceCircularizer(numtArguments.circular);
        final CircularCoordinates coordinates = circularizer.coordinatesFor(mito);

        final List<AlignmentHit> alignmentHits = hitsFormat.readHits(hits.toPath());
        logger.info(String.format("Read %d hits on %d assembly sequences from %s", alignmentHits.size(),
                alignmentHits.stream().map(AlignmentHit::getSequenceName).distinct().count(), hits));
        if (alignmentHits.isEmpty()) {
            logger.warn("No hits in " + hits + "; all outputs will be empty");
        }
        final Set<String> exclusions = ExclusionList.resolve(numtArguments.exclude);
        if (!exclusions.isEmpty()) {
            logger.info(String.format("Excluding %d sequences given on the command line", exclusions.size()));
        }

        final NumtFinderResult result = new NumtFinderEngine(numtArguments, coordinates, mito.getName())
                .run(alignmentHits, exclusions);

        // every input is read and checked before the first output is written
        final Map<String, ReferenceSequence> assemblySequences = (fragmentFasta || blockFasta)
                ? FastaSequences.readSequences(assembly.toPath(), sequencesWithOutput(result))
                : Collections.emptyMap();
        final NumtSequenceWriter sequenceWriter = new NumtSequenceWriter(assemblySequences);
        if (fragmentFasta) {
            sequenceWriter.checkWithinAssembly(result.getFragments());
        }
        if (blockFasta) {
            sequenceWriter.checkWithinAssembly(result.getBlocks());
        }

        if (circularizedOutput != null) {
            FastaSequences.write(circularizedOutput.toPath(), Collections.singletonList(circularizer.circularize(mito)));
        }
        writeTables(result);
        ExclusionList.write(outputFile(EXCLUSION_LIST_SUFFIX), result.getExclusions());
        if (fragmentFasta) {
            sequenceWriter.writeFragments(outputFile(FRAGMENT_FASTA_SUFFIX).toPath(), result.getFragments(), fragmentRevcomp);
        }
        if (blockFasta) {
            sequenceWriter.writeBlocks(outputFile(BLOCK_FASTA_SUFFIX).toPath(), result.getBlocks());
        }

        logger.info(String.format("%d NUMT fragments in %d blocks; %d self-hits; %d warnings",
                result.getFragments().size(), result.getBlocks().size(), result.getSelfHits().size(), result.getWarnings().size()));
        return result;
    }

    private static Set<String> sequencesWithOutput(final NumtFinderResult result) {
        return Stream.concat(result.getFragments().stream().map(NumtFragment::getContig),
                        result.getBlocks().stream().map(NumtBlock::getContig))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void writeTables(final NumtFinderResult result) {
        final File fragmentTable = outputFile(FRAGMENT_TABLE_SUFFIX);
        try (final NumtFragmentTableWriter writer = new NumtFragmentTableWriter(fragmentTable)) {
            writer.writeAllRecords(result.getFragments());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(fragmentTable, e);
        }

        final File blockTable = outputFile(BLOCK_TABLE_SUFFIX);
        try (final NumtBlockTableWriter writer = new NumtBlockTableWriter(blockTable)) {
            for (final String warning : result.getWarnings()) {
                writer.writeComment("WARNING: " + warning);
            }
            writer.writeAllRecords(result.getBlocks());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(blockTable, e);
        }

        final File depthTable = outputFile(DEPTH_TABLE_SUFFIX);
        try (final CoverageDepthTableWriter writer = new CoverageDepthTableWriter(depthTable, result.getCoverage())) {
            writer.writeProfile();
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(depthTable, e);
        }

        final File coverageTable = outputFile(COVERAGE_TABLE_SUFFIX);
        try (final CoverageSummaryTableWriter writer = new CoverageSummaryTableWriter(coverageTable)) {
            writer.writeRecord(result.getCoverage());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(coverageTable, e);
        }

        final File selfHitTable = outputFile(SELF_HIT_TABLE_SUFFIX);
        try (final SelfHitTableWriter writer = new SelfHitTableWriter(selfHitTable)) {
            writer.writeAllRecords(result.getSelfHits());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(selfHitTable, e);
        }
    }

    private File outputFile(final String suffix) {
        return new File(outputPrefix + suffix);
    }
}
