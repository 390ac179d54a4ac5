package org.broadinstitute.fastproject.tools.signatures.pipeline;

import org.broadinstitute.fastproject.tools.signatures.qc.SampleQualityReport;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final models, keyed by model name, and the per-sample quality report.
 */
public final class AnalysisResult {

    private final Map<String, Model> models;
    private final SampleQualityReport qualityReport;

    public AnalysisResult(final Map<String, Model> models, final SampleQualityReport qualityReport) {
        Utils.nonNull(models);
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.qualityReport = Utils.nonNull(qualityReport);
    }

    public Map<String, Model> getModels() {
        return models;
    }

    public Model getModel(final String name) {
        final Model model = models.get(name);
        Utils.validateArg(model != null, () -> String.format("no model named %s; available: %s", name, models.keySet()));
        return model;
    }

    public SampleQualityReport getQualityReport() {
        return qualityReport;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final Model model : models.values()) {
            builder.append(String.format("%s: %d genes, %d samples, %d signature scores, %d projection data%n",
                    model.getName(), model.getData().numGenes(), model.getSampleLabels().size(),
                    model.getSignatureScores().size(), model.getProjectionData().size()));
        }
        builder.append(String.format("Quality control: %d of %d samples pass",
                qualityReport.passingSamples().size(), qualityReport.getSamples().size()));
        return builder.toString();
    }
}
