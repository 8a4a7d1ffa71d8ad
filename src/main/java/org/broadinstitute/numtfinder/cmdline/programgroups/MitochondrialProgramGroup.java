package org.broadinstitute.numtfinder.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that locate and summarise nuclear copies of mitochondrial DNA.
 */
public class MitochondrialProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Mitochondrial";
    public static final String DESCRIPTION = "Tools that locate nuclear mitochondrial fragments (NUMTs) in genome assemblies";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return DESCRIPTION; }
}
