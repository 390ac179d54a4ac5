package org.broadinstitute.fastproject.tools.signatures.scoring;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * One value per sample for a signature, a precomputed covariate or a derived quantity.
 *
 * <p>
 *     Continuous scores hold a double per sample. Factor scores hold an integer level code per sample
 *     together with the level names.
 * </p>
 */
public final class SignatureScore {

    private final String name;
    private final List<String> samples;
    private final double[] values;
    private final int[] levelCodes;
    private final List<String> levels;
    private final boolean precomputed;
    private final int numGenes;

    private SignatureScore(final String name, final List<String> samples, final double[] values,
                           final int[] levelCodes, final List<String> levels,
                           final boolean precomputed, final int numGenes) {
        this.name = name;
        this.samples = samples;
        this.values = values;
        this.levelCodes = levelCodes;
        this.levels = levels;
        this.precomputed = precomputed;
        this.numGenes = numGenes;
    }

    /**
     * Creates a continuous score.
     * @param numGenes number of signature genes that contributed; 0 for precomputed or derived scores
     */
    public static SignatureScore continuous(final String name, final List<String> samples, final double[] values,
                                            final boolean precomputed, final int numGenes) {
        Utils.nonEmpty(name, "score name");
        checkSamples(samples);
        Utils.nonNull(values);
        Utils.validateArg(values.length == samples.size(), "the number of values does not match the number of samples");
        Utils.validateArg(numGenes >= 0, "numGenes must be >= 0");
        return new SignatureScore(name, Collections.unmodifiableList(new ArrayList<>(samples)), values.clone(),
                null, null, precomputed, numGenes);
    }

    /**
     * Creates a precomputed factor score from one level label per sample. Levels are numbered
     * in order of first appearance.
     */
    public static SignatureScore factor(final String name, final List<String> samples, final List<String> labels) {
        Utils.nonEmpty(name, "score name");
        checkSamples(samples);
        Utils.nonNull(labels);
        Utils.containsNoNull(labels, "factor labels cannot contain null");
        Utils.validateArg(labels.size() == samples.size(), "the number of labels does not match the number of samples");
        final List<String> levels = new ArrayList<>();
        final Object2IntMap<String> levelIndex = new Object2IntOpenHashMap<>();
        levelIndex.defaultReturnValue(-1);
        final int[] codes = new int[labels.size()];
        for (int j = 0; j < codes.length; j++) {
            final String label = labels.get(j);
            int code = levelIndex.getInt(label);
            if (code < 0) {
                code = levels.size();
                levels.add(label);
                levelIndex.put(label, code);
            }
            codes[j] = code;
        }
        return new SignatureScore(name, Collections.unmodifiableList(new ArrayList<>(samples)), null,
                codes, Collections.unmodifiableList(levels), true, 0);
    }

    private static void checkSamples(final List<String> samples) {
        Utils.nonNull(samples, "the samples cannot be null");
        Utils.containsNoNull(samples, "samples cannot contain null");
        Utils.validateArg(new HashSet<>(samples).size() == samples.size(), "samples contain duplicates");
    }

    public String getName() {
        return name;
    }

    public List<String> getSamples() {
        return samples;
    }

    public int numSamples() {
        return samples.size();
    }

    public boolean isFactor() {
        return levelCodes != null;
    }

    public boolean isPrecomputed() {
        return precomputed;
    }

    public int getNumGenes() {
        return numGenes;
    }

    /**
     * @return a copy of the per-sample values.
     * @throws IllegalStateException for factor scores.
     */
    public double[] getValues() {
        Utils.validate(!isFactor(), () -> String.format("score '%s' is a factor", name));
        return values.clone();
    }

    /**
     * @return a copy of the per-sample level codes.
     * @throws IllegalStateException for continuous scores.
     */
    public int[] getLevelCodes() {
        Utils.validate(isFactor(), () -> String.format("score '%s' is not a factor", name));
        return levelCodes.clone();
    }

    public List<String> getLevels() {
        Utils.validate(isFactor(), () -> String.format("score '%s' is not a factor", name));
        return levels;
    }

    public int numLevels() {
        return isFactor() ? levels.size() : 0;
    }

    /**
     * Restricts and reorders the score to the given samples.
     * @throws IllegalArgumentException if any requested sample is unknown.
     */
    public SignatureScore subsetSamples(final List<String> samplesInOrder) {
        Utils.nonNull(samplesInOrder);
        if (samplesInOrder.equals(samples)) {
            return this;
        }
        final Object2IntMap<String> index = sampleIndex();
        final int[] columns = new int[samplesInOrder.size()];
        for (int j = 0; j < columns.length; j++) {
            final String sample = samplesInOrder.get(j);
            columns[j] = index.getInt(sample);
            Utils.validateArg(columns[j] >= 0, () -> String.format("score '%s' has no value for sample '%s'", name, sample));
        }
        final List<String> resultSamples = Collections.unmodifiableList(new ArrayList<>(samplesInOrder));
        if (isFactor()) {
            return new SignatureScore(name, resultSamples, null,
                    Arrays.stream(columns).map(c -> levelCodes[c]).toArray(), levels, precomputed, numGenes);
        }
        return new SignatureScore(name, resultSamples, Arrays.stream(columns).mapToDouble(c -> values[c]).toArray(),
                null, null, precomputed, numGenes);
    }

    /**
     * Appends the samples of another score of the same name and type. Factor levels are matched by name.
     */
    public SignatureScore appendSamples(final SignatureScore other) {
        Utils.nonNull(other);
        Utils.validateArg(other.name.equals(name), "cannot append a score with a different name");
        Utils.validateArg(other.isFactor() == isFactor(), "cannot append a factor to a continuous score or vice versa");
        final Object2IntMap<String> index = sampleIndex();
        for (final String sample : other.samples) {
            Utils.validateArg(!index.containsKey(sample), () -> String.format("sample '%s' is already present", sample));
        }
        final List<String> resultSamples = new ArrayList<>(samples);
        resultSamples.addAll(other.samples);
        if (!isFactor()) {
            final double[] resultValues = Arrays.copyOf(values, values.length + other.values.length);
            System.arraycopy(other.values, 0, resultValues, values.length, other.values.length);
            return new SignatureScore(name, Collections.unmodifiableList(resultSamples), resultValues, null, null, precomputed, numGenes);
        }
        final List<String> labels = new ArrayList<>(resultSamples.size());
        Arrays.stream(levelCodes).forEach(c -> labels.add(levels.get(c)));
        Arrays.stream(other.levelCodes).forEach(c -> labels.add(other.levels.get(c)));
        return factor(name, resultSamples, labels);
    }

    private Object2IntMap<String> sampleIndex() {
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>(samples.size());
        index.defaultReturnValue(-1);
        for (int j = 0; j < samples.size(); j++) {
            index.put(samples.get(j), j);
        }
        return index;
    }

    @Override
    public String toString() {
        return String.format("SignatureScore{name=%s, factor=%s, precomputed=%s, numGenes=%d}", name, isFactor(), precomputed, numGenes);
    }
}
