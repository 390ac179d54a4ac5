package org.broadinstitute.fastproject.tools.signatures.io;

import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;
import java.util.List;

public final class SignatureReaderUnitTest extends BaseTest {

    @Test
    public void testReadGmt() {
        final File file = createTempFile("signatures", ".gmt",
                "UP\tgenes going up\tA\tB\tC",
                "DOWN\t\tD\tE");
        final List<Signature> signatures = SignatureReader.read(file);
        Assert.assertEquals(signatures.size(), 2);
        final Signature up = signatures.get(0);
        Assert.assertEquals(up.getName(), "UP");
        Assert.assertFalse(up.isSigned());
        Assert.assertEquals(up.getGenes(), Arrays.asList("A", "B", "C"));
        Assert.assertTrue(up.getSigns().values().stream().allMatch(sign -> sign == 1));
        Assert.assertEquals(up.getSource(), file.getName());
    }

    @Test
    public void testReadSigned() {
        final List<Signature> signatures = SignatureReader.read(createTempFile("signatures", ".txt",
                "CELL_CYCLE\tplus\tA",
                "STRESS\t-\tX",
                "CELL_CYCLE\tminus\tB",
                "CELL_CYCLE\t1\tC"));
        Assert.assertEquals(signatures.size(), 2);
        final Signature cellCycle = signatures.get(0);
        Assert.assertEquals(cellCycle.getName(), "CELL_CYCLE");
        Assert.assertTrue(cellCycle.isSigned());
        Assert.assertEquals((int) cellCycle.getSigns().get("A"), 1);
        Assert.assertEquals((int) cellCycle.getSigns().get("B"), -1);
        Assert.assertEquals((int) cellCycle.getSigns().get("C"), 1);
        Assert.assertEquals((int) signatures.get(1).getSigns().get("X"), -1);
    }

    @DataProvider(name = "malformed")
    public Object[][] malformed() {
        return new Object[][] {
                {".txt", new String[] {"SIG\tup\tA"}},
                {".txt", new String[] {"SIG\tplus"}},
                {".txt", new String[] {"SIG\tplus\tA", "SIG\tminus\tA"}},
                {".gmt", new String[] {"SIG\tdescription"}},
                {".gmt", new String[] {"SIG\td\tA", "SIG\td\tB"}},
        };
    }

    @Test(dataProvider = "malformed", expectedExceptions = UserException.MalformedFile.class)
    public void testMalformed(final String extension, final String[] lines) {
        SignatureReader.read(createTempFile("malformed", extension, lines));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testSameNameInTwoFiles() {
        final File first = createTempFile("first", ".gmt", "SIG\td\tA\tB");
        final File second = createTempFile("second", ".txt", "SIG\tplus\tC");
        SignatureReader.readAll(Arrays.asList(first, second));
    }
}
