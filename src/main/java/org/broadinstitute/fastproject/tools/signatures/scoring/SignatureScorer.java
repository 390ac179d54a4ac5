package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.engine.progressmeter.ProgressMeter;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.MathUtils;
import org.broadinstitute.fastproject.utils.Utils;
import org.broadinstitute.fastproject.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Scores signatures against an expression matrix with a fixed normalization and scoring method.
 *
 * <p>
 *     A signature whose overlap with the matrix genes is empty or below the minimum is returned as a
 *     {@link ScoringOutcome#skipped} outcome instead of failing.
 * </p>
 */
public final class SignatureScorer {
    private static final Logger logger = LogManager.getLogger(SignatureScorer.class);

    private final NormalizationMethod normalizationMethod;
    private final ScoringMethod scoringMethod;
    private final int minSignatureGenes;

    public SignatureScorer(final NormalizationMethod normalizationMethod, final ScoringMethod scoringMethod,
                           final int minSignatureGenes) {
        this.normalizationMethod = Utils.nonNull(normalizationMethod);
        this.scoringMethod = Utils.nonNull(scoringMethod);
        this.minSignatureGenes = ParamUtils.isPositive(minSignatureGenes, "the minimum number of signature genes must be > 0");
    }

    public NormalizationMethod getNormalizationMethod() {
        return normalizationMethod;
    }

    public ScoringMethod getScoringMethod() {
        return scoringMethod;
    }

    /**
     * Normalizes the matrix with its own row statistics.
     */
    public PreparedData prepare(final ExpressionMatrix data) {
        Utils.nonNull(data);
        return prepare(data, MathUtils.rowMeans(data.values()), MathUtils.rowStandardDeviations(data.values()));
    }

    /**
     * Normalizes the matrix with the given row statistics.
     */
    public PreparedData prepare(final ExpressionMatrix data, final double[] rowMeans, final double[] rowStandardDeviations) {
        Utils.nonNull(data);
        final RealMatrix normalized = normalizationMethod.normalize(data.values(), rowMeans, rowStandardDeviations);
        return new PreparedData(data, normalized, data.zeroMask());
    }

    /**
     * Scores one signature.
     */
    public ScoringOutcome score(final PreparedData prepared, final Signature signature) {
        Utils.nonNull(prepared);
        Utils.nonNull(signature);
        final ExpressionMatrix source = prepared.source;
        final List<Integer> presentRows = new ArrayList<>(signature.size());
        final List<Integer> presentSigns = new ArrayList<>(signature.size());
        for (final Map.Entry<String, Integer> entry : signature.getSigns().entrySet()) {
            final int row = source.geneIndex(entry.getKey());
            if (row >= 0) {
                presentRows.add(row);
                presentSigns.add(entry.getValue());
            }
        }
        if (presentRows.isEmpty()) {
            return ScoringOutcome.skipped(signature.getName(), "none of its genes are present in the data");
        }
        if (presentRows.size() < minSignatureGenes) {
            return ScoringOutcome.skipped(signature.getName(),
                    String.format("only %d of its genes are present in the data, at least %d are required", presentRows.size(), minSignatureGenes));
        }
        final int[] rows = presentRows.stream().mapToInt(Integer::intValue).toArray();
        final double[] signs = presentSigns.stream().mapToDouble(Integer::doubleValue).toArray();
        final double[] values = scoringMethod.score(prepared.normalized, rows, signs, prepared.zeros, source.weights());
        return ScoringOutcome.scored(SignatureScore.continuous(signature.getName(), source.samples(), values, false, rows.length));
    }

    /**
     * Scores a batch of signatures on {@code executor}; the outcomes follow the order of {@code signatures}.
     * @param recordLabel label for progress lines, e.g. "signatures"
     */
    public List<ScoringOutcome> scoreAll(final PreparedData prepared, final List<Signature> signatures,
                                         final ExecutorService executor, final String recordLabel) {
        Utils.nonNull(signatures);
        Utils.nonNull(executor);
        final ProgressMeter progressMeter = new ProgressMeter(recordLabel, signatures.size());
        progressMeter.start();
        final List<Future<ScoringOutcome>> futures = new ArrayList<>(signatures.size());
        for (final Signature signature : signatures) {
            futures.add(executor.submit(() -> {
                final ScoringOutcome outcome = score(prepared, signature);
                progressMeter.update(signature.getName());
                return outcome;
            }));
        }
        final List<ScoringOutcome> result = new ArrayList<>(futures.size());
        try {
            for (final Future<ScoringOutcome> future : futures) {
                result.add(future.get());
            }
        } catch (final InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new FastProjectException("interrupted while scoring " + recordLabel, e);
        } catch (final ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new FastProjectException("failed to score " + recordLabel, e.getCause());
        } finally {
            progressMeter.stop();
        }
        final long skipped = result.stream().filter(ScoringOutcome::isSkipped).count();
        result.stream().filter(ScoringOutcome::isSkipped)
                .forEach(o -> logger.debug(String.format("Skipping signature %s: %s", o.getSignatureName(), o.getSkipReason())));
        logger.info(String.format("Scored %d %s, skipped %d for insufficient gene coverage", result.size() - skipped, recordLabel, skipped));
        return result;
    }

    /**
     * A matrix normalized once for scoring many signatures.
     */
    public static final class PreparedData {
        private final ExpressionMatrix source;
        private final RealMatrix normalized;
        private final boolean[][] zeros;

        private PreparedData(final ExpressionMatrix source, final RealMatrix normalized, final boolean[][] zeros) {
            this.source = source;
            this.normalized = normalized;
            this.zeros = zeros;
        }

        public ExpressionMatrix getSource() {
            return source;
        }

        public RealMatrix getNormalized() {
            return normalized;
        }
    }
}
