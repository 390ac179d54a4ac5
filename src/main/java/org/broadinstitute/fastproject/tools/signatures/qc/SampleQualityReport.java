package org.broadinstitute.fastproject.tools.signatures.qc;

import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Quality score and pass/fail decision per sample.
 *
 * <p>
 *     A sample passes when its score is at most {@link #getCutoff()}. Higher scores mean worse samples.
 * </p>
 */
public final class SampleQualityReport {

    public static final String QUALITY_SCORE_NAME = "FP_Quality";

    public static final double MAD_MULTIPLIER = 1.6;

    private final List<String> samples;
    private final double[] scores;
    private final double cutoff;
    private final boolean enabled;

    private SampleQualityReport(final List<String> samples, final double[] scores, final double cutoff, final boolean enabled) {
        this.samples = samples;
        this.scores = scores;
        this.cutoff = cutoff;
        this.enabled = enabled;
    }

    /**
     * Evaluates the scores against median + {@value #MAD_MULTIPLIER} scaled median absolute deviations.
     */
    public static SampleQualityReport fromScores(final List<String> samples, final double[] scores) {
        Utils.nonNull(samples);
        Utils.nonNull(scores);
        Utils.validateArg(samples.size() == scores.length, "the number of scores does not match the number of samples");
        Utils.validateArg(scores.length > 0, "cannot evaluate quality of zero samples");
        final double cutoff = MathUtils.median(scores)
                + MAD_MULTIPLIER * MathUtils.MAD_NORMAL_SCALE * MathUtils.medianAbsoluteDeviation(scores);
        return new SampleQualityReport(Collections.unmodifiableList(new ArrayList<>(samples)), scores.clone(), cutoff, true);
    }

    /**
     * Report used when QC is not run: every score is 0 and every sample passes.
     */
    public static SampleQualityReport disabled(final List<String> samples) {
        Utils.nonNull(samples);
        return new SampleQualityReport(Collections.unmodifiableList(new ArrayList<>(samples)), new double[samples.size()],
                Double.POSITIVE_INFINITY, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getSamples() {
        return samples;
    }

    public double[] getScores() {
        return scores.clone();
    }

    public double getCutoff() {
        return cutoff;
    }

    public boolean passes(final int sampleIndex) {
        return scores[sampleIndex] <= cutoff;
    }

    public boolean[] passMask() {
        final boolean[] result = new boolean[scores.length];
        for (int j = 0; j < result.length; j++) {
            result[j] = passes(j);
        }
        return result;
    }

    public List<String> passingSamples() {
        return IntStream.range(0, samples.size()).filter(this::passes).mapToObj(samples::get).collect(Collectors.toList());
    }

    /**
     * Keeps the given samples in the given order, with the same cutoff.
     */
    public SampleQualityReport subsetSamples(final List<String> samplesInOrder) {
        Utils.nonNull(samplesInOrder);
        final double[] resultScores = new double[samplesInOrder.size()];
        for (int j = 0; j < resultScores.length; j++) {
            final int index = samples.indexOf(samplesInOrder.get(j));
            final String sample = samplesInOrder.get(j);
            Utils.validateArg(index >= 0, () -> String.format("sample '%s' is not part of the quality report", sample));
            resultScores[j] = scores[index];
        }
        return new SampleQualityReport(Collections.unmodifiableList(new ArrayList<>(samplesInOrder)), resultScores, cutoff, enabled);
    }

    /**
     * Appends scores for additional samples, evaluated against this report's cutoff.
     */
    public SampleQualityReport appendSamples(final List<String> additionalSamples, final double[] additionalScores) {
        Utils.nonNull(additionalSamples);
        Utils.nonNull(additionalScores);
        Utils.validateArg(additionalSamples.size() == additionalScores.length, "the number of scores does not match the number of samples");
        final List<String> resultSamples = new ArrayList<>(samples);
        resultSamples.addAll(additionalSamples);
        final double[] resultScores = Arrays.copyOf(scores, scores.length + additionalScores.length);
        System.arraycopy(additionalScores, 0, resultScores, scores.length, additionalScores.length);
        return new SampleQualityReport(Collections.unmodifiableList(resultSamples), resultScores, cutoff, enabled);
    }

    /**
     * The quality scores as a precomputed continuous score named {@value #QUALITY_SCORE_NAME}.
     */
    public SignatureScore toSignatureScore() {
        return SignatureScore.continuous(QUALITY_SCORE_NAME, samples, scores, true, 0);
    }
}
