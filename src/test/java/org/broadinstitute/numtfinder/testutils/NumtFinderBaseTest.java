package org.broadinstitute.numtfinder.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.numtfinder.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * This is the base test class for all of our test cases. It quiets the logging and resolves the location of the
 * test resource directories.
 */
public abstract class NumtFinderBaseTest {

    private static final String CURRENT_DIRECTORY = System.getProperty("user.dir");

    public static final String publicTestDir = new File(CURRENT_DIRECTORY, "src/test/resources").getAbsolutePath() + "/";
    public static final String packageRootTestDir = publicTestDir + "org/broadinstitute/numtfinder/";
    public static final String numtTestDir = packageRootTestDir + "tools/numt/";

    /** 1000 bp circular mitochondrial reference used by the tool tests. */
    public static final File MITO_REFERENCE = new File(numtTestDir, "mito.fasta");
    /** Assembly the hits in {@link #MITO_HITS} come from. */
    public static final File ASSEMBLY = new File(numtTestDir, "assembly.fasta");
    public static final File MITO_HITS = new File(numtTestDir, "hits.tsv");

    @BeforeSuite
    public void setTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * @return a file in the temporary directory that will be deleted on exit
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return a directory in the temporary directory; it and its content are deleted on exit
     */
    public static File createTempDir(final String prefix) {
        try {
            final File dir = Files.createTempDirectory(prefix).toFile();
            dir.deleteOnExit();
            return dir;
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes the lines into a temp file.
     */
    public static File writeTempFile(final String name, final String extension, final String... lines) {
        final File file = createTempFile(name, extension);
        try {
            Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    public static List<String> readLines(final File file) {
        try {
            return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the lines of a table file without its comment lines
     */
    public static List<String> readTableLines(final File file) {
        return readLines(file).stream().filter(l -> !l.startsWith("#")).collect(Collectors.toList());
    }

    /**
     * @return the tab separated fields of every data line, header and comments excluded
     */
    public static List<String[]> readTableRows(final File file) {
        final List<String> lines = readTableLines(file);
        final List<String[]> rows = new ArrayList<>();
        for (final String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            rows.add(line.split("\t", -1));
        }
        return rows;
    }

    public static void assertFileExists(final Path path) {
        Assert.assertTrue(Files.exists(path), "missing " + path);
    }

    /**
     * Returns the name of the class being tested: the simple name of the test class without its trailing
     * {@code UnitTest}, {@code IntegrationTest} or {@code Test}.
     */
    public String getTestedClassName() {
        final String name = getClass().getSimpleName();
        if (name.contains("IntegrationTest")) {
            return name.replaceAll("IntegrationTest$", "");
        } else if (name.contains("UnitTest")) {
            return name.replaceAll("UnitTest$", "");
        }
        return name.replaceAll("Test$", "");
    }
}
