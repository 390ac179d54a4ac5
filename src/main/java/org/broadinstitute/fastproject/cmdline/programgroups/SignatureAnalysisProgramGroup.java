package org.broadinstitute.fastproject.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that score gene signatures and relate them to low-dimensional projections of expression data
 */
public final class SignatureAnalysisProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return "Signature Analysis"; }

    @Override
    public String getDescription() { return "Tools that score gene signatures against projections of expression data"; }
}
