package org.broadinstitute.fastproject.tools.signatures;

import org.broadinstitute.barclay.argparser.Advanced;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.scoring.BackgroundSignatureGenerator;
import org.broadinstitute.fastproject.tools.signatures.scoring.NormalizationMethod;
import org.broadinstitute.fastproject.tools.signatures.scoring.ScoringMethod;
import org.broadinstitute.fastproject.tools.signatures.significance.SignatureProjectionSignificance;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Options of the signature analysis pipeline.
 */
public final class SignatureAnalysisArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String SUBSAMPLE_SIZE_LONG_NAME = "subsample-size";
    public static final String THRESHOLD_LONG_NAME = "threshold";
    public static final String NOFILTER_LONG_NAME = "nofilter";
    public static final String LEAN_LONG_NAME = "lean";
    public static final String NOMODEL_LONG_NAME = "nomodel";
    public static final String QC_LONG_NAME = "qc";
    public static final String ALL_SIGS_LONG_NAME = "all-sigs";
    public static final String PROBABILITY_MODEL_LONG_NAME = "probability-model";
    public static final String SIG_NORM_METHOD_LONG_NAME = "sig-norm-method";
    public static final String SIG_SCORE_METHOD_LONG_NAME = "sig-score-method";
    public static final String MIN_SIGNATURE_GENES_LONG_NAME = "min-signature-genes";
    public static final String BACKGROUND_SIZES_LONG_NAME = "background-sizes";
    public static final String BACKGROUND_REPETITIONS_LONG_NAME = "background-repetitions";
    public static final String RANDOM_SEED_LONG_NAME = "random-seed";
    public static final String THREADS_LONG_NAME = "threads";
    public static final String FACTOR_PERMUTATIONS_LONG_NAME = "factor-permutations";

    public static final String DEFAULT_SIG_NORM_METHOD = NormalizationMethod.ZNORM_COLUMNS.getMethodName();
    public static final String DEFAULT_SIG_SCORE_METHOD = ScoringMethod.WEIGHTED_AVG.getMethodName();
    public static final int DEFAULT_MIN_SIGNATURE_GENES = 5;
    public static final double DEFAULT_THRESHOLD_FRACTION = 0.2;

    @Argument(
            doc = "Number of samples to analyze; the remaining samples are placed in the final projections afterwards. " +
                    "By default all samples are analyzed.",
            fullName = SUBSAMPLE_SIZE_LONG_NAME,
            optional = true
    )
    public Integer subsampleSize = null;

    @Argument(
            doc = "Minimum number of samples a gene must be detected in to pass the Threshold filter. " +
                    "By default 20% of the analyzed samples.",
            fullName = THRESHOLD_LONG_NAME,
            optional = true
    )
    public Integer threshold = null;

    @Argument(
            doc = "Only use the No_Filter gene set.",
            fullName = NOFILTER_LONG_NAME,
            optional = true
    )
    public boolean nofilter = false;

    @Argument(
            doc = "Skip the Fano filter and the spectral embedding to reduce running time.",
            fullName = LEAN_LONG_NAME,
            optional = true
    )
    public boolean lean = false;

    @Argument(
            doc = "Skip the expression model, the false-negative correction and sample quality control.",
            fullName = NOMODEL_LONG_NAME,
            optional = true
    )
    public boolean nomodel = false;

    @Argument(
            doc = "Remove samples that fail quality control before scoring.",
            fullName = QC_LONG_NAME,
            optional = true
    )
    public boolean qc = false;

    @Argument(
            doc = "Report every signature instead of the significant ones.",
            fullName = ALL_SIGS_LONG_NAME,
            optional = true
    )
    public boolean allSigs = false;

    @Argument(
            doc = "Also analyze the false-negative corrected probabilities of expression as a separate model.",
            fullName = PROBABILITY_MODEL_LONG_NAME,
            optional = true
    )
    public boolean probabilityModel = false;

    @Argument(
            doc = "Normalization applied to the expression data before scoring signatures.",
            fullName = SIG_NORM_METHOD_LONG_NAME,
            optional = true
    )
    public String sigNormMethod = DEFAULT_SIG_NORM_METHOD;

    @Argument(
            doc = "Method used to combine gene values into a signature score.",
            fullName = SIG_SCORE_METHOD_LONG_NAME,
            optional = true
    )
    public String sigScoreMethod = DEFAULT_SIG_SCORE_METHOD;

    @Argument(
            doc = "Signatures with fewer genes present in the data are not scored.",
            fullName = MIN_SIGNATURE_GENES_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int minSignatureGenes = DEFAULT_MIN_SIGNATURE_GENES;

    @Advanced
    @Argument(
            doc = "Sizes of the random signatures used to estimate significance.",
            fullName = BACKGROUND_SIZES_LONG_NAME,
            optional = true
    )
    public List<Integer> backgroundSizes = Arrays.stream(BackgroundSignatureGenerator.DEFAULT_SIZES).boxed()
            .collect(Collectors.toCollection(ArrayList::new));

    @Advanced
    @Argument(
            doc = "Number of random signatures drawn for each background size.",
            fullName = BACKGROUND_REPETITIONS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int backgroundRepetitions = BackgroundSignatureGenerator.DEFAULT_REPETITIONS;

    @Argument(
            doc = "Seed for sub-sampling, background signatures, clustering and permutations.",
            fullName = RANDOM_SEED_LONG_NAME,
            optional = true
    )
    public Long randomSeed = null;

    @Argument(
            doc = "Number of threads used to score signatures.",
            fullName = THREADS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int threads = Runtime.getRuntime().availableProcessors();

    @Advanced
    @Argument(
            doc = "Number of label permutations used to estimate the significance of factor signatures.",
            fullName = FACTOR_PERMUTATIONS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int factorPermutations = SignatureProjectionSignificance.DEFAULT_FACTOR_PERMUTATIONS;

    /**
     * Checks the values that the argument parser cannot check by itself.
     * @throws UserException.BadArgumentValue for the first invalid value found.
     */
    public void validate() {
        getNormalizationMethod();
        getScoringMethod();
        if (subsampleSize != null && subsampleSize < 1) {
            throw new UserException.BadArgumentValue(SUBSAMPLE_SIZE_LONG_NAME, subsampleSize.toString(), "The sub-sample size must be positive.");
        }
        if (threshold != null && threshold < 0) {
            throw new UserException.BadArgumentValue(THRESHOLD_LONG_NAME, threshold.toString(), "The threshold cannot be negative.");
        }
        if (minSignatureGenes < 1) {
            throw new UserException.BadArgumentValue(MIN_SIGNATURE_GENES_LONG_NAME, Integer.toString(minSignatureGenes), "At least one gene is required.");
        }
        if (backgroundSizes == null || backgroundSizes.isEmpty()) {
            throw new UserException.BadArgumentValue(BACKGROUND_SIZES_LONG_NAME, "At least one background size is required.");
        }
        for (final Integer size : backgroundSizes) {
            if (size == null || size < 1) {
                throw new UserException.BadArgumentValue(BACKGROUND_SIZES_LONG_NAME, String.valueOf(size), "Background sizes must be positive.");
            }
        }
        if (backgroundRepetitions < 1) {
            throw new UserException.BadArgumentValue(BACKGROUND_REPETITIONS_LONG_NAME, Integer.toString(backgroundRepetitions), "Must be positive.");
        }
        if (threads < 1) {
            throw new UserException.BadArgumentValue(THREADS_LONG_NAME, Integer.toString(threads), "Must be positive.");
        }
        if (factorPermutations < 1) {
            throw new UserException.BadArgumentValue(FACTOR_PERMUTATIONS_LONG_NAME, Integer.toString(factorPermutations), "Must be positive.");
        }
        if (nomodel && (qc || probabilityModel)) {
            throw new UserException.BadArgumentValue(NOMODEL_LONG_NAME, "true",
                    String.format("--%s and --%s require the expression model.", QC_LONG_NAME, PROBABILITY_MODEL_LONG_NAME));
        }
    }

    /**
     * @throws UserException.BadArgumentValue if the name is not a known normalization method.
     */
    public NormalizationMethod getNormalizationMethod() {
        return NormalizationMethod.fromName(SIG_NORM_METHOD_LONG_NAME, sigNormMethod);
    }

    /**
     * @throws UserException.BadArgumentValue if the name is not a known scoring method.
     */
    public ScoringMethod getScoringMethod() {
        return ScoringMethod.fromName(SIG_SCORE_METHOD_LONG_NAME, sigScoreMethod);
    }

    public int[] getBackgroundSizes() {
        return backgroundSizes.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * The detection threshold for the given number of analyzed samples.
     */
    public int resolveThreshold(final int numAnalyzedSamples) {
        return threshold != null ? threshold : (int) (DEFAULT_THRESHOLD_FRACTION * numAnalyzedSamples);
    }
}
