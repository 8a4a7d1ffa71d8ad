package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.broadinstitute.numtfinder.tools.numt.BlockMerger;
import org.broadinstitute.numtfinder.tools.numt.CircularCoordinates;
import org.broadinstitute.numtfinder.tools.numt.CoverageAggregator;
import org.broadinstitute.numtfinder.tools.numt.CoverageProfile;
import org.broadinstitute.numtfinder.tools.numt.NumtBlock;
import org.broadinstitute.numtfinder.tools.numt.NumtFragment;
import org.broadinstitute.numtfinder.tools.numt.SelfHitCall;
import org.broadinstitute.numtfinder.tools.numt.Strand;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.broadinstitute.numtfinder.tools.numt.NumtTestUtils.fragment;

public final class NumtTableWritersUnitTest extends NumtFinderBaseTest {

    private static final NumtFragment PLUS = fragment(3, "scaffold1", 100, 200, Strand.PLUS, 95, 101, 201);
    private static final NumtFragment WRAPPED = fragment(5, "scaffold1", 1000, 1050, Strand.MINUS, 48, 980, 30);

    private static String[] lines(final StringWriter writer) {
        return writer.toString().split("\n");
    }

    @Test
    public void testFragmentTable() throws IOException {
        final StringWriter out = new StringWriter();
        try (final NumtFragmentTableWriter writer = new NumtFragmentTableWriter(out)) {
            writer.writeAllRecords(Arrays.asList(PLUS, WRAPPED));
        }
        final String[] lines = lines(out);
        Assert.assertEquals(lines.length, 3);
        Assert.assertEquals(lines[0], "FragNum\tSeqName\tStart\tEnd\tStrand\tBitScore\tExpect\tLength\tIdentity\tmtStart\tmtEnd");
        Assert.assertEquals(lines[1], "3\tscaffold1\t100\t200\t+\t190\t1.0E-10\t101\t95\t101\t201");
        Assert.assertEquals(lines[2], "5\tscaffold1\t1000\t1050\t-\t96\t1.0E-10\t51\t48\t980\t30");
    }

    @Test
    public void testBlockTableWithWarnings() throws IOException {
        final List<NumtBlock> blocks = new BlockMerger(8000, false).merge(Arrays.asList(PLUS, WRAPPED));
        final StringWriter out = new StringWriter();
        try (final NumtBlockTableWriter writer = new NumtBlockTableWriter(out)) {
            writer.writeComment("WARNING: 1 blocks combine fragments from both strands");
            writer.writeAllRecords(blocks);
        }
        final String[] lines = lines(out);
        Assert.assertEquals(lines[0], "#WARNING: 1 blocks combine fragments from both strands");
        Assert.assertEquals(lines[1], "SeqName\tStart\tEnd\tStrand\tBitScore\tExpect\tLength\tIdentity\tmtFrag\tFragNum\tFragLen\tFragGaps");
        Assert.assertEquals(lines[2], "scaffold1\t100\t1050\t+/-\t286\t1.0E-10\t152\t143\t3|5\t2\t152\t799");
    }

    @Test
    public void testEmptyTableHasHeader() throws IOException {
        final StringWriter out = new StringWriter();
        new NumtBlockTableWriter(out).close();
        Assert.assertEquals(lines(out).length, 1);
        Assert.assertTrue(lines(out)[0].startsWith("SeqName\tStart"));
    }

    @Test
    public void testCoverageTables() throws IOException {
        final CoverageProfile profile = new CoverageAggregator(new CircularCoordinates(1000, true))
                .aggregate("chrM", Collections.singletonList(WRAPPED));

        final StringWriter depth = new StringWriter();
        try (final CoverageDepthTableWriter writer = new CoverageDepthTableWriter(depth, profile)) {
            writer.writeProfile();
        }
        final String[] depthLines = lines(depth);
        Assert.assertEquals(depthLines.length, 1001);
        Assert.assertEquals(depthLines[0], "Locus\tPos\tX");
        Assert.assertEquals(depthLines[1], "chrM\t1\t1");
        Assert.assertEquals(depthLines[31], "chrM\t31\t0");
        Assert.assertEquals(depthLines[1000], "chrM\t1000\t1");

        final StringWriter summary = new StringWriter();
        try (final CoverageSummaryTableWriter writer = new CoverageSummaryTableWriter(summary)) {
            writer.writeRecord(profile);
        }
        Assert.assertEquals(lines(summary), new String[]{
                "Locus\tLength\tCovered\tCoverage\tMeanX\tMedianX\tMaxX",
                "chrM\t1000\t51\t5.10\t0.05\t0.00\t1"});
    }

    @Test
    public void testSelfHitTable() throws IOException {
        final StringWriter out = new StringWriter();
        try (final SelfHitTableWriter writer = new SelfHitTableWriter(out)) {
            writer.writeRecord(new SelfHitCall("mito", 100.0, 99.5, Arrays.asList(2, 3), Collections.emptyList(), true));
            writer.writeRecord(new SelfHitCall("mitoPlus", 99.2, 99.0, Collections.singletonList(7), Arrays.asList(8, 9), false));
        }
        Assert.assertEquals(lines(out), new String[]{
                "SeqName\tCoverage\tIdentity\tContributing\tExtra\tExcluded",
                "mito\t100.00\t99.50\t2|3\t-\ttrue",
                "mitoPlus\t99.20\t99.00\t7\t8|9\tfalse"});
    }

    @Test
    public void testFormatScore() {
        Assert.assertEquals(NumtTableColumns.formatScore(180.0), "180");
        Assert.assertEquals(NumtTableColumns.formatScore(0.0), "0");
        Assert.assertEquals(NumtTableColumns.formatScore(61.5), "61.5");
        Assert.assertEquals(NumtTableColumns.formatScore(1e-40), "1.0E-40");
    }
}
