package org.broadinstitute.numtfinder.tools.numt.io;

import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.FastaReferenceWriterBuilder;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * FASTA access through htsjdk. Files are read sequentially so that no index or dictionary is needed.
 */
public final class FastaSequences {
    private static final Logger logger = LogManager.getLogger(FastaSequences.class);

    public static final int BASES_PER_LINE = 80;

    private FastaSequences() {}

    /**
     * Loads the mitochondrial reference: the first sequence of the FASTA file.
     *
     * @param circular whether the reference will be treated as circular; extra sequences get a warning in that case
     * @throws UserException.MissingReference if the file holds no sequence
     */
    public static ReferenceSequence readMitochondrialReference(final Path fasta, final boolean circular) {
        checkReadable(fasta);
        try (final ReferenceSequenceFile file = ReferenceSequenceFileFactory.getReferenceSequenceFile(fasta)) {
            final ReferenceSequence first = file.nextSequence();
            if (first == null) {
                throw new UserException.MissingReference("no sequence found in mitochondrial reference " + fasta);
            }
            int others = 0;
            while (file.nextSequence() != null) {
                others++;
            }
            if (others > 0) {
                final String message = String.format("%s holds %d sequences; only the first (%s) is used as the mitochondrial reference",
                        fasta, others + 1, first.getName());
                if (circular) {
                    logger.warn(message);
                } else {
                    logger.info(message);
                }
            }
            return first;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(fasta, e);
        }
    }

    /**
     * Loads the named sequences of a FASTA file, in file order. Other sequences are skipped without being kept.
     *
     * @throws UserException.BadInput if a requested name is absent
     */
    public static Map<String, ReferenceSequence> readSequences(final Path fasta, final Set<String> names) {
        checkReadable(fasta);
        Utils.nonNull(names, "names");
        final Map<String, ReferenceSequence> result = new LinkedHashMap<>();
        try (final ReferenceSequenceFile file = ReferenceSequenceFileFactory.getReferenceSequenceFile(fasta)) {
            ReferenceSequence sequence;
            while (result.size() < names.size() && (sequence = file.nextSequence()) != null) {
                if (names.contains(sequence.getName())) {
                    result.put(sequence.getName(), sequence);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(fasta, e);
        }
        for (final String name : names) {
            if (!result.containsKey(name)) {
                throw new UserException.BadInput(String.format("sequence %s has hits but is not present in %s", name, fasta));
            }
        }
        return result;
    }

    public static FastaReferenceWriter openWriter(final Path output) throws IOException {
        return new FastaReferenceWriterBuilder()
                .setFastaFile(output)
                .setBasesPerLine(BASES_PER_LINE)
                .setMakeFaiOutput(false)
                .setMakeDictOutput(false)
                .build();
    }

    public static void write(final Path output, final Iterable<ReferenceSequence> sequences) {
        Utils.nonNull(output, "output");
        try (final FastaReferenceWriter writer = openWriter(output)) {
            for (final ReferenceSequence sequence : sequences) {
                writer.startSequence(sequence.getName()).appendBases(sequence.getBases());
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output.toString(), "could not write FASTA", e);
        }
    }

    private static void checkReadable(final Path fasta) {
        Utils.nonNull(fasta, "fasta");
        if (!Files.isRegularFile(fasta) || !Files.isReadable(fasta)) {
            throw new UserException.CouldNotReadInputFile(fasta, "file does not exist or is not readable");
        }
    }
}
