package org.broadinstitute.haplomix.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that read lineage trees and estimate haplogroup mixtures
 */
public class HaplogroupAnalysisProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Haplogroup Analysis";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return "Tools that summarize phylogenetic lineage trees and estimate haplogroup mixture proportions"; }
}
