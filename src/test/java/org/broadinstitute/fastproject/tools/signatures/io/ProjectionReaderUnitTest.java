package org.broadinstitute.fastproject.tools.signatures.io;

import org.apache.commons.io.FilenameUtils;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;

public final class ProjectionReaderUnitTest extends BaseTest {

    @Test
    public void testRead() {
        final File file = createTempFile("umap", ".txt", "sample\tx\ty", "s1\t0.5\t-1", "s2\t2\t3");
        final Projection projection = ProjectionReader.read(file);
        Assert.assertEquals(projection.getName(), FilenameUtils.getBaseName(file.getName()));
        Assert.assertEquals(projection.getSamples(), Arrays.asList("s1", "s2"));
        Assert.assertEquals(projection.getX(0), 0.5);
        Assert.assertEquals(projection.getY(0), -1.0);
        Assert.assertEquals(projection.getY(1), 3.0);
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testThreeDimensions() {
        ProjectionReader.read(createTempFile("umap", ".txt", "sample\tx\ty", "s1\t0.5\t-1\t2"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testDuplicateSample() {
        ProjectionReader.read(createTempFile("umap", ".txt", "sample\tx\ty", "s1\t0\t0", "s1\t1\t1"));
    }
}
