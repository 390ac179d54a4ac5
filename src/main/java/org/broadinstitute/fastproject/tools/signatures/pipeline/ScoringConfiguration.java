package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.scoring.NormalizationMethod;
import org.broadinstitute.fastproject.tools.signatures.scoring.ScoringMethod;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScorer;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Normalization and scoring method used for one kind of model.
 */
public final class ScoringConfiguration {

    private final NormalizationMethod normalizationMethod;
    private final ScoringMethod scoringMethod;

    public ScoringConfiguration(final NormalizationMethod normalizationMethod, final ScoringMethod scoringMethod) {
        this.normalizationMethod = Utils.nonNull(normalizationMethod);
        this.scoringMethod = Utils.nonNull(scoringMethod);
    }

    public NormalizationMethod getNormalizationMethod() {
        return normalizationMethod;
    }

    public ScoringMethod getScoringMethod() {
        return scoringMethod;
    }

    public SignatureScorer createScorer(final int minSignatureGenes) {
        return new SignatureScorer(normalizationMethod, scoringMethod, minSignatureGenes);
    }

    /**
     * Expression models use the configured methods; probabilities are scored as they are with the naive mean.
     */
    public static Map<DataKind, ScoringConfiguration> byKind(final NormalizationMethod expressionNormalization,
                                                             final ScoringMethod expressionScoring) {
        final Map<DataKind, ScoringConfiguration> table = new EnumMap<>(DataKind.class);
        table.put(DataKind.EXPRESSION, new ScoringConfiguration(expressionNormalization, expressionScoring));
        table.put(DataKind.PROBABILITY, new ScoringConfiguration(NormalizationMethod.NONE, ScoringMethod.NAIVE));
        return Collections.unmodifiableMap(table);
    }

    @Override
    public String toString() {
        return String.format("%s/%s", normalizationMethod.getMethodName(), scoringMethod.getMethodName());
    }
}
