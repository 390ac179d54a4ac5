package org.broadinstitute.fastproject.tools.signatures.io;

import org.broadinstitute.fastproject.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class GeneListReaderUnitTest extends BaseTest {

    @Test
    public void testRead() {
        Assert.assertEquals(GeneListReader.read(createTempFile("housekeeping", ".txt", "# housekeeping", "ACTB", "GAPDH\textra", "ACTB", " RPL13 ")),
                Arrays.asList("ACTB", "GAPDH", "RPL13"));
    }
}
