package org.broadinstitute.fastproject.tools.signatures.scoring;

import org.broadinstitute.fastproject.utils.Utils;

/**
 * Result of scoring one signature: either a score or the reason it was skipped.
 */
public final class ScoringOutcome {

    private final String signatureName;
    private final SignatureScore score;
    private final String skipReason;

    private ScoringOutcome(final String signatureName, final SignatureScore score, final String skipReason) {
        this.signatureName = signatureName;
        this.score = score;
        this.skipReason = skipReason;
    }

    public static ScoringOutcome scored(final SignatureScore score) {
        Utils.nonNull(score);
        return new ScoringOutcome(score.getName(), score, null);
    }

    public static ScoringOutcome skipped(final String signatureName, final String reason) {
        Utils.nonNull(signatureName);
        Utils.nonNull(reason);
        return new ScoringOutcome(signatureName, null, reason);
    }

    public String getSignatureName() {
        return signatureName;
    }

    public boolean isSkipped() {
        return score == null;
    }

    /**
     * @throws IllegalStateException if the signature was skipped.
     */
    public SignatureScore getScore() {
        Utils.validate(score != null, () -> String.format("signature '%s' was skipped: %s", signatureName, skipReason));
        return score;
    }

    /**
     * @return the skip reason, or {@code null} if scored.
     */
    public String getSkipReason() {
        return skipReason;
    }
}
