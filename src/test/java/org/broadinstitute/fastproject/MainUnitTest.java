package org.broadinstitute.fastproject;

import org.broadinstitute.fastproject.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.fastproject.testutils.ArgumentsBuilder;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.SignatureAnalysisArgumentCollection;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;

public final class MainUnitTest extends BaseTest {

    private static File expressionFile() {
        return createTempFile("expression", ".txt", "gene\ts1\ts2", "A\t1\t2", "B\t3\t0");
    }

    @DataProvider(name = "exitValues")
    public Object[][] exitValues() {
        final File signatures = createTempFile("signatures", ".gmt", "SIG\td\tA\tB");
        return new Object[][] {
                {new String[0], 0},
                {new String[] {"--help"}, 0},
                {new String[] {"NoSuchTool"}, Main.USER_EXCEPTION_EXIT_VALUE},
                // missing required input
                {new ArgumentsBuilder().addRaw("AnalyzeSignatures").addSignatures(signatures).getArgsArray(), Main.COMMANDLINE_EXCEPTION_EXIT_VALUE},
                // neither signatures nor precomputed scores
                {new ArgumentsBuilder().addRaw("AnalyzeSignatures").addInput(expressionFile()).getArgsArray(), Main.COMMANDLINE_EXCEPTION_EXIT_VALUE},
                {new ArgumentsBuilder().addRaw("AnalyzeSignatures").addInput(getSafeNonExistentFile("missing.txt"))
                        .addSignatures(signatures).getArgsArray(), Main.USER_EXCEPTION_EXIT_VALUE},
                {new ArgumentsBuilder().addRaw("AnalyzeSignatures").addInput(expressionFile()).addSignatures(signatures)
                        .add(SignatureAnalysisArgumentCollection.SIG_SCORE_METHOD_LONG_NAME, "median")
                        .add(StandardArgumentDefinitions.VERBOSITY_NAME, "ERROR").getArgsArray(), Main.USER_EXCEPTION_EXIT_VALUE},
        };
    }

    @Test(dataProvider = "exitValues")
    public void testExitValue(final String[] args, final int expected) {
        Assert.assertEquals(new Main().mainEntry(args), expected);
    }
}
