package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops signatures that are not significant on any projection of a model.
 *
 * <p>
 *     Signatures are ranked by their smallest log10 p-value over all projection data of the model, ties broken by
 *     name. With K = min({@value #MAX_RETAINED}, number of signatures that are not precomputed):
 * </p>
 * <ul>
 *     <li>for datasets of more than {@value #LARGE_DATASET_SAMPLES} samples exactly the top K are kept;</li>
 *     <li>otherwise every signature at or below max(log10(0.05), rank-K value) is kept.</li>
 * </ul>
 * <p>
 *     Precomputed scores are always kept. The decision is applied to the score map and to every projection data.
 * </p>
 */
public final class SignificancePruner {
    private static final Logger logger = LogManager.getLogger(SignificancePruner.class);

    public static final int MAX_RETAINED = 200;
    public static final int LARGE_DATASET_SAMPLES = 2000;
    public static final double LOG10_SIGNIFICANCE = Math.log10(0.05);

    /**
     * @param originalSampleCount number of samples in the input, before sub-sampling and QC
     * @param allSignatures if true, nothing is pruned
     * @throws FastProjectException.InconsistentSignatureStateException if a signature that is not precomputed has no
     *          significance in any projection data.
     */
    public PruneDecision decide(final Model model, final int originalSampleCount, final boolean allSignatures) {
        Utils.nonNull(model);
        final Map<String, SignatureScore> scores = model.getSignatureScores();
        if (allSignatures) {
            return new PruneDecision(scores.keySet(), new LinkedHashSet<>(), Double.POSITIVE_INFINITY, false);
        }
        final Map<String, Double> minimumLogP = new HashMap<>();
        for (final ProjectionData pd : model.getProjectionData()) {
            pd.minimumLogPValues().forEach((name, p) -> minimumLogP.merge(name, p, Math::min));
        }
        final List<String> eligible = new ArrayList<>();
        for (final SignatureScore score : scores.values()) {
            if (!score.isPrecomputed()) {
                if (!minimumLogP.containsKey(score.getName())) {
                    throw new FastProjectException.InconsistentSignatureStateException(model.getName(),
                            String.format("signature %s has no significance in any projection", score.getName()));
                }
                eligible.add(score.getName());
            }
        }
        final int k = Math.min(MAX_RETAINED, eligible.size());
        final List<String> ranked = eligible.stream()
                .sorted(Comparator.<String>comparingDouble(minimumLogP::get).thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());

        final Set<String> keepEligible;
        final double threshold;
        final boolean strict = originalSampleCount > LARGE_DATASET_SAMPLES;
        if (k == 0) {
            keepEligible = new LinkedHashSet<>();
            threshold = Double.POSITIVE_INFINITY;
        } else if (strict) {
            keepEligible = new LinkedHashSet<>(ranked.subList(0, k));
            threshold = minimumLogP.get(ranked.get(k - 1));
        } else {
            threshold = Math.max(LOG10_SIGNIFICANCE, minimumLogP.get(ranked.get(k - 1)));
            keepEligible = ranked.stream().filter(name -> minimumLogP.get(name) <= threshold)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        final Set<String> retained = new LinkedHashSet<>();
        final Set<String> pruned = new LinkedHashSet<>();
        for (final SignatureScore score : scores.values()) {
            if (score.isPrecomputed() || keepEligible.contains(score.getName())) {
                retained.add(score.getName());
            } else {
                pruned.add(score.getName());
            }
        }
        return new PruneDecision(retained, pruned, threshold, strict);
    }

    /**
     * Applies {@link #decide} and checks the consistency of the result.
     */
    public Model prune(final Model model, final int originalSampleCount, final boolean allSignatures) {
        final PruneDecision decision = decide(model, originalSampleCount, allSignatures);
        final Model result = apply(model, decision);
        logger.info(String.format("Model %s: kept %d signatures, pruned %d", model.getName(),
                decision.getRetained().size(), decision.getPruned().size()));
        return result;
    }

    /**
     * Restricts the score map and every projection data to the retained signatures.
     */
    public static Model apply(final Model model, final PruneDecision decision) {
        Utils.nonNull(model);
        Utils.nonNull(decision);
        final List<SignatureScore> keptScores = model.getSignatureScores().values().stream()
                .filter(s -> decision.getRetained().contains(s.getName()))
                .collect(Collectors.toList());
        final List<ProjectionData> keptProjectionData = model.getProjectionData().stream()
                .map(pd -> pd.retainSignatures(decision.getRetained()))
                .collect(Collectors.toList());
        final Model result = model.withSignatureScores(keptScores).withProjectionData(keptProjectionData);
        result.validateConsistency();
        return result;
    }
}
