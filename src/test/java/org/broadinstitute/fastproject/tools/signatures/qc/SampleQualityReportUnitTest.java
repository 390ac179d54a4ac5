package org.broadinstitute.fastproject.tools.signatures.qc;

import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class SampleQualityReportUnitTest extends BaseTest {

    private static final List<String> SAMPLES = Arrays.asList("A", "B", "C", "D", "E");

    @Test
    public void testCutoffIsMedianPlusScaledMad() {
        final SampleQualityReport report = SampleQualityReport.fromScores(SAMPLES, new double[] {1, 2, 3, 4, 100});
        // median 3, deviations {2, 1, 0, 1, 97} -> MAD 1
        Assert.assertEquals(report.getCutoff(), 3 + 1.6 * 1.4826, 1e-12);
        Assert.assertEquals(report.passingSamples(), Arrays.asList("A", "B", "C", "D"));
        Assert.assertEquals(report.passMask(), new boolean[] {true, true, true, true, false});
        Assert.assertTrue(report.isEnabled());
    }

    @Test
    public void testDisabled() {
        final SampleQualityReport report = SampleQualityReport.disabled(SAMPLES);
        Assert.assertFalse(report.isEnabled());
        Assert.assertEquals(report.getScores(), new double[5]);
        Assert.assertEquals(report.passingSamples(), SAMPLES);
    }

    @Test
    public void testSubsetAndAppendKeepCutoff() {
        final SampleQualityReport report = SampleQualityReport.fromScores(SAMPLES, new double[] {1, 2, 3, 4, 100});
        final SampleQualityReport subset = report.subsetSamples(Arrays.asList("C", "A"));
        Assert.assertEquals(subset.getScores(), new double[] {3, 1});
        Assert.assertEquals(subset.getCutoff(), report.getCutoff());
        final SampleQualityReport appended = subset.appendSamples(Collections.singletonList("F"), new double[] {50});
        Assert.assertEquals(appended.getSamples(), Arrays.asList("C", "A", "F"));
        Assert.assertFalse(appended.passes(2));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSubsetUnknownSample() {
        SampleQualityReport.disabled(SAMPLES).subsetSamples(Collections.singletonList("Z"));
    }

    @Test
    public void testToSignatureScore() {
        final SignatureScore score = SampleQualityReport.fromScores(SAMPLES, new double[] {1, 2, 3, 4, 5}).toSignatureScore();
        Assert.assertEquals(score.getName(), SampleQualityReport.QUALITY_SCORE_NAME);
        Assert.assertTrue(score.isPrecomputed());
        Assert.assertEquals(score.getValues(), new double[] {1, 2, 3, 4, 5});
    }
}
