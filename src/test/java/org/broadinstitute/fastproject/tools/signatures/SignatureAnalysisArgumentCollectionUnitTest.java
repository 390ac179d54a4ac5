package org.broadinstitute.fastproject.tools.signatures;

import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.testutils.BaseTest;
import org.broadinstitute.fastproject.tools.signatures.scoring.NormalizationMethod;
import org.broadinstitute.fastproject.tools.signatures.scoring.ScoringMethod;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.function.Consumer;

public final class SignatureAnalysisArgumentCollectionUnitTest extends BaseTest {

    @Test
    public void testDefaults() {
        final SignatureAnalysisArgumentCollection arguments = new SignatureAnalysisArgumentCollection();
        arguments.validate();
        Assert.assertEquals(arguments.getNormalizationMethod(), NormalizationMethod.ZNORM_COLUMNS);
        Assert.assertEquals(arguments.getScoringMethod(), ScoringMethod.WEIGHTED_AVG);
        Assert.assertEquals(arguments.minSignatureGenes, 5);
        Assert.assertEquals(arguments.resolveThreshold(99), 19);
        Assert.assertTrue(arguments.getBackgroundSizes().length > 0);
    }

    @Test
    public void testExplicitThreshold() {
        final SignatureAnalysisArgumentCollection arguments = new SignatureAnalysisArgumentCollection();
        arguments.threshold = 3;
        Assert.assertEquals(arguments.resolveThreshold(1000), 3);
    }

    @DataProvider(name = "invalid")
    public Object[][] invalid() {
        final Object[][] cases = {
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.sigNormMethod = "zscore"},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.sigScoreMethod = "median"},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.subsampleSize = 0},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.threshold = -1},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.minSignatureGenes = 0},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.backgroundSizes = new ArrayList<>()},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.backgroundSizes = new ArrayList<>(Arrays.asList(5, 0))},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.backgroundSizes = new ArrayList<>(Collections.singletonList(null))},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.backgroundRepetitions = 0},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.threads = 0},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> a.factorPermutations = 0},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> { a.nomodel = true; a.qc = true; }},
                {(Consumer<SignatureAnalysisArgumentCollection>) a -> { a.nomodel = true; a.probabilityModel = true; }},
        };
        return cases;
    }

    @Test(dataProvider = "invalid", expectedExceptions = UserException.BadArgumentValue.class)
    public void testInvalid(final Consumer<SignatureAnalysisArgumentCollection> change) {
        final SignatureAnalysisArgumentCollection arguments = new SignatureAnalysisArgumentCollection();
        change.accept(arguments);
        arguments.validate();
    }
}
