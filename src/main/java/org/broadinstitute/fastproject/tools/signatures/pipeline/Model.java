package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One analyzed representation of the data (expression or probability) with its signature scores and
 * projection data.
 */
public final class Model {

    private final String name;
    private final DataKind kind;
    private final ExpressionMatrix data;
    private final Map<String, SignatureScore> signatureScores;
    private final List<ProjectionData> projectionData;

    public Model(final DataKind kind, final ExpressionMatrix data) {
        this(kind, data, Collections.emptyMap(), Collections.emptyList());
    }

    private Model(final DataKind kind, final ExpressionMatrix data, final Map<String, SignatureScore> signatureScores,
                  final List<ProjectionData> projectionData) {
        this.kind = Utils.nonNull(kind);
        this.name = kind.getModelName();
        this.data = Utils.nonNull(data);
        Utils.validateArg(data.kind() == kind, "the model kind does not match the data kind");
        this.signatureScores = Collections.unmodifiableMap(new LinkedHashMap<>(signatureScores));
        this.projectionData = Collections.unmodifiableList(new ArrayList<>(projectionData));
    }

    public String getName() {
        return name;
    }

    public DataKind getKind() {
        return kind;
    }

    public ExpressionMatrix getData() {
        return data;
    }

    /**
     * @return unmodifiable ordered map from score name to score.
     */
    public Map<String, SignatureScore> getSignatureScores() {
        return signatureScores;
    }

    public List<String> getSampleLabels() {
        return data.samples();
    }

    public List<ProjectionData> getProjectionData() {
        return projectionData;
    }

    public Model withData(final ExpressionMatrix newData) {
        return new Model(kind, newData, signatureScores, projectionData);
    }

    /**
     * @param scores scores in the order they should be reported; names must be unique
     */
    public Model withSignatureScores(final List<SignatureScore> scores) {
        Utils.nonNull(scores);
        final Map<String, SignatureScore> map = new LinkedHashMap<>();
        for (final SignatureScore score : scores) {
            Utils.validateArg(map.put(score.getName(), score) == null,
                    () -> String.format("model %s already has a score named %s", name, score.getName()));
        }
        return new Model(kind, data, map, projectionData);
    }

    public Model withProjectionData(final List<ProjectionData> newProjectionData) {
        return new Model(kind, data, signatureScores, Utils.nonNull(newProjectionData));
    }

    /**
     * Checks that every projection data's signature keys are scores of this model, that every score, projection
     * and cluster labeling covers exactly the model's samples, and that significance rows match their keys.
     *
     * @throws FastProjectException.InconsistentSignatureStateException on any violation.
     */
    public void validateConsistency() {
        final List<String> samples = getSampleLabels();
        for (final SignatureScore score : signatureScores.values()) {
            if (!score.getSamples().equals(samples)) {
                throw new FastProjectException.InconsistentSignatureStateException(name,
                        String.format("score %s does not cover the model samples", score.getName()));
            }
        }
        for (final ProjectionData pd : projectionData) {
            final List<String> keys = pd.getSignatureKeys();
            for (final String key : keys) {
                if (!signatureScores.containsKey(key)) {
                    throw new FastProjectException.InconsistentSignatureStateException(name,
                            String.format("projection data %s refers to unknown signature %s", pd.describe(), key));
                }
            }
            if (pd.getSigProjMatrix().length != keys.size() || pd.getSigProjMatrixP().length != keys.size()) {
                throw new FastProjectException.InconsistentSignatureStateException(name,
                        String.format("projection data %s has %d signature keys but matrices of %d and %d rows", pd.describe(),
                                keys.size(), pd.getSigProjMatrix().length, pd.getSigProjMatrixP().length));
            }
            if (!pd.getSamples().equals(samples)) {
                throw new FastProjectException.InconsistentSignatureStateException(name,
                        String.format("projections of %s do not cover the model samples", pd.describe()));
            }
        }
    }
}
