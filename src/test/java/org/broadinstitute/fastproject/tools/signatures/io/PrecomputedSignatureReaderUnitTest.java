package org.broadinstitute.fastproject.tools.signatures.io;

import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Map;

public final class PrecomputedSignatureReaderUnitTest extends BaseTest {

    @Test
    public void testRead() {
        final Map<String, SignatureScore> scores = PrecomputedSignatureReader.read(createTempFile("precomputed", ".txt",
                "sample\tdepth\tbatch",
                "s1\t1000\tA",
                "s2\t2500.5\tB",
                "s3\t0\tA"));
        Assert.assertEquals(scores.keySet().toArray(), new String[] {"depth", "batch"});
        final SignatureScore depth = scores.get("depth");
        Assert.assertFalse(depth.isFactor());
        Assert.assertTrue(depth.isPrecomputed());
        Assert.assertEquals(depth.getSamples(), Arrays.asList("s1", "s2", "s3"));
        Assert.assertEquals(depth.getValues(), new double[] {1000, 2500.5, 0});
        final SignatureScore batch = scores.get("batch");
        Assert.assertTrue(batch.isFactor());
        Assert.assertTrue(batch.isPrecomputed());
        Assert.assertEquals(batch.numLevels(), 2);
        Assert.assertEquals(batch.getLevelCodes(), new int[] {0, 1, 0});
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testDuplicateSample() {
        PrecomputedSignatureReader.read(createTempFile("precomputed", ".txt", "sample\tdepth", "s1\t1", "s1\t2"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testHeaderOnly() {
        PrecomputedSignatureReader.read(createTempFile("precomputed", ".txt", "sample\tdepth"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testRaggedLine() {
        PrecomputedSignatureReader.read(createTempFile("precomputed", ".txt", "sample\tdepth\tbatch", "s1\t1"));
    }
}
