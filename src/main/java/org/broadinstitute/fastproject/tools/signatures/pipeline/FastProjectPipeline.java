package org.broadinstitute.fastproject.tools.signatures.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.FastProjectException;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.SignatureAnalysisArgumentCollection;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.filters.GeneFilters;
import org.broadinstitute.fastproject.tools.signatures.projection.ClusterAssigner;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.projection.ProjectionGenerator;
import org.broadinstitute.fastproject.tools.signatures.projection.ProjectionResult;
import org.broadinstitute.fastproject.tools.signatures.qc.QualityControlResult;
import org.broadinstitute.fastproject.tools.signatures.qc.QualityControlTransform;
import org.broadinstitute.fastproject.tools.signatures.qc.SampleQualityReport;
import org.broadinstitute.fastproject.tools.signatures.scoring.BackgroundSignatureGenerator;
import org.broadinstitute.fastproject.tools.signatures.scoring.ScoringOutcome;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScorer;
import org.broadinstitute.fastproject.tools.signatures.significance.SignatureProjectionSignificance;
import org.broadinstitute.fastproject.tools.signatures.significance.SignificanceMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs the signature analysis: sub-sampling, gene filters, quality control, signature scoring, projections,
 * clusters, significance, pruning, merging of held-out samples and gene ordering.
 *
 * <p>
 *     Each stage returns new values; the pipeline only replaces whole {@link Model}s between stages. Failures of a
 *     stage are reported as a {@link PipelineStageException} naming the stage, except for {@link UserException}s and
 *     {@link FastProjectException.InconsistentSignatureStateException}s, which are passed on unchanged.
 * </p>
 */
public final class FastProjectPipeline {
    private static final Logger logger = LogManager.getLogger(FastProjectPipeline.class);

    public static final String ZERO_PROPORTION_SCORE_NAME = "Zero_Proportion";

    private static final Set<String> RESERVED_SCORE_NAMES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList(SampleQualityReport.QUALITY_SCORE_NAME, ZERO_PROPORTION_SCORE_NAME)));

    private final SignatureAnalysisArgumentCollection arguments;
    private final RandomGenerator random;

    private PipelineStage stage = PipelineStage.INIT;

    /**
     * @param random source for every random choice of the run; child sources are drawn from it in a fixed order
     */
    public FastProjectPipeline(final SignatureAnalysisArgumentCollection arguments, final RandomGenerator random) {
        this.arguments = Utils.nonNull(arguments);
        this.random = Utils.nonNull(random);
    }

    /**
     * Creates a pipeline seeded from {@code arguments.randomSeed}, or from the clock when no seed is given.
     */
    public static FastProjectPipeline fromArguments(final SignatureAnalysisArgumentCollection arguments) {
        Utils.nonNull(arguments);
        final Random seedSource = arguments.randomSeed == null ? new Random() : new Random(arguments.randomSeed);
        return new FastProjectPipeline(arguments, RandomGeneratorFactory.createRandomGenerator(seedSource));
    }

    /**
     * The stage the last call to {@link #run} reached.
     */
    public PipelineStage getStage() {
        return stage;
    }

    /**
     * @param expression expression matrix, genes x samples
     * @param signatures signatures to score; names must be unique
     * @param precomputed precomputed scores by name, each covering every sample of {@code expression}
     * @param housekeepingGenes genes for the false-negative curves
     * @param inputProjections externally supplied projections by name, each covering every sample
     * @param inputWeights externally supplied weights with the layout of {@code expression}, or {@code null}
     * @throws UserException.BadArgumentValue for invalid arguments, before any stage runs.
     * @throws UserException.BadInput for inconsistent inputs, before any stage runs.
     */
    public AnalysisResult run(final ExpressionMatrix expression, final List<Signature> signatures,
                              final Map<String, SignatureScore> precomputed, final Collection<String> housekeepingGenes,
                              final Map<String, Projection> inputProjections, final ExpressionMatrix inputWeights) {
        stage = PipelineStage.INIT;
        arguments.validate();
        validateInputs(expression, signatures, precomputed, housekeepingGenes, inputProjections);
        final Map<DataKind, ScoringConfiguration> scoringTable =
                ScoringConfiguration.byKind(arguments.getNormalizationMethod(), arguments.getScoringMethod());
        final Map<String, Signature> signaturesByName = new LinkedHashMap<>();
        signatures.forEach(s -> signaturesByName.put(s.getName(), s));
        final int originalSampleCount = expression.numSamples();
        logger.info(String.format("Analyzing %d genes, %d samples and %d signatures", expression.numGenes(), originalSampleCount, signatures.size()));

        // child random sources, drawn in a fixed order
        final SampleSubsampler subsampler = new SampleSubsampler(childRandom());
        final RandomGenerator backgroundRandom = childRandom();
        final ClusterAssigner clusterAssigner = new ClusterAssigner(childRandom());
        final RandomGenerator significanceRandom = childRandom();

        final ExecutorService executor = Executors.newFixedThreadPool(arguments.threads,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("signature-scoring-%d").build());
        try {
            final SampleSubsampler.Split split = runStage(PipelineStage.SUBSAMPLE, () ->
                    arguments.subsampleSize == null ? subsampler.split(expression, Integer.MAX_VALUE) : subsampler.split(expression, arguments.subsampleSize));
            final ExpressionMatrix working = split.getWorking();
            final int threshold = arguments.resolveThreshold(working.numSamples());

            final ExpressionMatrix filtered = runStage(PipelineStage.FILTER, () ->
                    GeneFilters.apply(working, threshold, arguments.nofilter, arguments.lean));

            // QC
            final QualityControlResult qcResult = arguments.nomodel ? null : runStage(PipelineStage.QC, () ->
                    new QualityControlTransform().apply(filtered, working, housekeepingGenes, inputWeights));
            final Map<String, Model> models = new LinkedHashMap<>();
            SampleQualityReport report;
            if (qcResult == null) {
                models.put(DataKind.EXPRESSION.getModelName(), new Model(DataKind.EXPRESSION, filtered));
                report = SampleQualityReport.disabled(filtered.samples());
            } else {
                models.put(DataKind.EXPRESSION.getModelName(), new Model(DataKind.EXPRESSION, filtered.withWeights(qcResult.getWeights())));
                if (arguments.probabilityModel) {
                    models.put(DataKind.PROBABILITY.getModelName(), new Model(DataKind.PROBABILITY, qcResult.getProbabilityData()));
                }
                report = qcResult.getReport();
                if (arguments.qc) {
                    final boolean[] passing = report.passMask();
                    final List<String> passingSamples = report.passingSamples();
                    if (passingSamples.isEmpty()) {
                        throw new PipelineStageException(PipelineStage.QC, "no sample passes quality control");
                    }
                    logger.info(String.format("Removing %d samples that fail quality control", passing.length - passingSamples.size()));
                    models.replaceAll((name, model) -> model.withData(model.getData().subsetSamples(passing)));
                    report = report.subsetSamples(passingSamples);
                }
            }
            final SampleQualityReport workingReport = report;
            final SignatureScore zeroProportion = zeroProportion(models.get(DataKind.EXPRESSION.getModelName()).getData());

            // SCORE
            stage = PipelineStage.SCORE;
            final List<Signature> background = runStage(PipelineStage.SCORE, () ->
                    new BackgroundSignatureGenerator(arguments.getBackgroundSizes(), arguments.backgroundRepetitions, backgroundRandom)
                            .generate(models.get(DataKind.EXPRESSION.getModelName()).getData().genes()));
            final Map<String, List<SignatureScore>> backgroundScores = new LinkedHashMap<>();
            for (final String name : new ArrayList<>(models.keySet())) {
                final Model model = models.get(name);
                final SignatureScorer scorer = scoringTable.get(model.getKind()).createScorer(arguments.minSignatureGenes);
                logger.info(String.format("Scoring signatures on model %s with %s", name, scoringTable.get(model.getKind())));
                final List<SignatureScore> modelScores = runStage(PipelineStage.SCORE, () -> {
                    final SignatureScorer.PreparedData prepared = scorer.prepare(model.getData());
                    final List<SignatureScore> scores = scored(scorer.scoreAll(prepared, signatures, executor, "signatures"));
                    backgroundScores.put(name, scored(scorer.scoreAll(prepared, background, executor, "background signatures")));
                    for (final SignatureScore score : precomputed.values()) {
                        scores.add(score.subsetSamples(model.getSampleLabels()));
                    }
                    if (workingReport.isEnabled()) {
                        scores.add(workingReport.toSignatureScore());
                    }
                    scores.add(zeroProportion);
                    return scores;
                });
                models.put(name, model.withSignatureScores(modelScores));
            }

            // PROJECT, CLUSTER and SIGNIFICANCE for each filter
            final ProjectionGenerator projectionGenerator = new ProjectionGenerator(arguments.lean);
            final SignatureProjectionSignificance significance =
                    new SignatureProjectionSignificance(significanceRandom, arguments.factorPermutations, executor);
            for (final String name : new ArrayList<>(models.keySet())) {
                final Model model = models.get(name);
                final List<SignatureScore> scores = new ArrayList<>(model.getSignatureScores().values());
                final List<ProjectionData> projectionData = new ArrayList<>();
                for (final String filterName : model.getData().filters().keySet()) {
                    logger.info(String.format("Model %s, filter %s", name, filterName));
                    final ExpressionMatrix restricted = model.getData().restrictToFilter(filterName);

                    final ProjectionResult raw = runStage(PipelineStage.PROJECT, () -> projectionGenerator.generate(restricted, inputProjections));
                    projectionData.add(analyzeProjections(filterName, restricted.genes(), false, raw, clusterAssigner,
                            significance, scores, backgroundScores.get(name)));

                    final ProjectionResult reduced = runStage(PipelineStage.PROJECT, () -> projectionGenerator.generate(raw.getReduced()));
                    projectionData.add(analyzeProjections(filterName, restricted.genes(), true, reduced, clusterAssigner,
                            significance, scores, backgroundScores.get(name)));
                }
                models.put(name, model.withProjectionData(projectionData));
            }

            // PRUNE
            stage = PipelineStage.PRUNE;
            final SignificancePruner pruner = new SignificancePruner();
            for (final String name : new ArrayList<>(models.keySet())) {
                final Model model = models.get(name);
                models.put(name, runStage(PipelineStage.PRUNE, () -> pruner.prune(model, originalSampleCount, arguments.allSigs)));
            }

            // MERGE_HOLDOUTS
            if (split.isSplit()) {
                stage = PipelineStage.MERGE_HOLDOUTS;
                final ExpressionMatrix holdout = split.getHoldout();
                logger.info(String.format("Merging %d held-out samples", holdout.numSamples()));
                report = runStage(PipelineStage.MERGE_HOLDOUTS, () -> mergeHoldouts(models, holdout, qcResult, workingReport,
                        scoringTable, signaturesByName, precomputed, inputWeights, subsampler));
            }

            // REORDER_GENES
            final Model expressionModel = models.get(DataKind.EXPRESSION.getModelName());
            models.put(expressionModel.getName(), runStage(PipelineStage.REORDER_GENES, () ->
                    expressionModel.withData(expressionModel.getData().arrangeGenes(GeneOrdering.leafOrder(expressionModel.getData())))));

            stage = PipelineStage.DONE;
            models.values().forEach(Model::validateConsistency);
            logger.info("Signature analysis complete");
            return new AnalysisResult(models, report);
        } finally {
            executor.shutdownNow();
        }
    }

    private ProjectionData analyzeProjections(final String filterName, final List<String> genes, final boolean pca,
                                              final ProjectionResult result, final ClusterAssigner clusterAssigner,
                                              final SignatureProjectionSignificance significance,
                                              final List<SignatureScore> scores, final List<SignatureScore> backgroundScores) {
        final Map<String, Map<String, int[]>> clusters = runStage(PipelineStage.CLUSTER, () ->
                clusterAssigner.defineClusters(result.getProjections()));
        final SignificanceMatrix matrix = runStage(PipelineStage.SIGNIFICANCE, () ->
                significance.compute(result.getProjections(), scores, backgroundScores));
        final RealMatrix loadings = pca ? result.getReduced().getLeadingLoadings(3) : null;
        return new ProjectionData(filterName, genes, pca, result.getProjections(), clusters, matrix, loadings);
    }

    /**
     * Merges the held-out samples into every model and returns the quality report extended with them.
     * With quality control filtering on, held-out samples failing the working-set cutoff are dropped first.
     */
    private SampleQualityReport mergeHoldouts(final Map<String, Model> models, final ExpressionMatrix holdout,
                                              final QualityControlResult qcResult, final SampleQualityReport workingReport,
                                              final Map<DataKind, ScoringConfiguration> scoringTable,
                                              final Map<String, Signature> signaturesByName,
                                              final Map<String, SignatureScore> precomputed,
                                              final ExpressionMatrix inputWeights, final SampleSubsampler subsampler) {
        final List<String> filteredGenes = models.get(DataKind.EXPRESSION.getModelName()).getData().genes();
        ExpressionMatrix holdoutFiltered = holdout.subsetGenes(new HashSet<>(filteredGenes));

        final QualityControlResult holdoutQc = qcResult == null ? null
                : QualityControlTransform.applyToAdditionalSamples(holdoutFiltered, holdout, qcResult, inputWeights);
        SampleQualityReport holdoutReport = holdoutQc == null ? SampleQualityReport.disabled(holdout.samples()) : holdoutQc.getReport();
        ExpressionMatrix holdoutExpression = holdoutQc == null ? holdoutFiltered : holdoutFiltered.withWeights(holdoutQc.getWeights());
        ExpressionMatrix holdoutProbability = holdoutQc == null ? null : holdoutQc.getProbabilityData();

        if (arguments.qc && holdoutQc != null) {
            final List<String> passingSamples = holdoutReport.passingSamples();
            logger.info(String.format("Removing %d held-out samples that fail quality control",
                    holdout.numSamples() - passingSamples.size()));
            if (passingSamples.isEmpty()) {
                return workingReport;
            }
            final boolean[] passing = holdoutReport.passMask();
            holdoutFiltered = holdoutFiltered.subsetSamples(passing);
            holdoutExpression = holdoutExpression.subsetSamples(passing);
            holdoutProbability = holdoutProbability.subsetSamples(passing);
            holdoutReport = holdoutReport.subsetSamples(passingSamples);
        }
        final List<String> holdoutSamples = holdoutFiltered.samples();

        final Map<String, SignatureScore> holdoutPrecomputed = new LinkedHashMap<>();
        precomputed.forEach((name, score) -> holdoutPrecomputed.put(name, score.subsetSamples(holdoutSamples)));
        if (workingReport.isEnabled()) {
            holdoutPrecomputed.put(SampleQualityReport.QUALITY_SCORE_NAME, holdoutReport.toSignatureScore());
        }
        holdoutPrecomputed.put(ZERO_PROPORTION_SCORE_NAME, zeroProportion(holdoutFiltered));

        for (final String name : new ArrayList<>(models.keySet())) {
            final Model model = models.get(name);
            final ExpressionMatrix holdoutData = model.getKind() == DataKind.PROBABILITY ? holdoutProbability : holdoutExpression;
            final SignatureScorer scorer = scoringTable.get(model.getKind()).createScorer(arguments.minSignatureGenes);
            models.put(name, subsampler.merge(model, holdoutData, scorer, signaturesByName, holdoutPrecomputed));
        }
        return workingReport.appendSamples(holdoutReport.getSamples(), holdoutReport.getScores());
    }

    /**
     * Fraction of genes with a zero value, per sample, over the genes that passed filtering.
     */
    static SignatureScore zeroProportion(final ExpressionMatrix data) {
        final boolean[][] zeros = data.zeroMask();
        final double[] proportions = new double[data.numSamples()];
        for (int j = 0; j < proportions.length; j++) {
            int count = 0;
            for (int i = 0; i < data.numGenes(); i++) {
                if (zeros[i][j]) {
                    count++;
                }
            }
            proportions[j] = (double) count / data.numGenes();
        }
        return SignatureScore.continuous(ZERO_PROPORTION_SCORE_NAME, data.samples(), proportions, true, 0);
    }

    private static List<SignatureScore> scored(final List<ScoringOutcome> outcomes) {
        return outcomes.stream().filter(o -> !o.isSkipped()).map(ScoringOutcome::getScore).collect(Collectors.toList());
    }

    private RandomGenerator childRandom() {
        return RandomGeneratorFactory.createRandomGenerator(new Random(random.nextLong()));
    }

    private <T> T runStage(final PipelineStage current, final Supplier<T> body) {
        stage = current;
        try {
            return body.get();
        } catch (final UserException | PipelineStageException | FastProjectException.InconsistentSignatureStateException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new PipelineStageException(current, e);
        }
    }

    private static void validateInputs(final ExpressionMatrix expression, final List<Signature> signatures,
                                       final Map<String, SignatureScore> precomputed, final Collection<String> housekeepingGenes,
                                       final Map<String, Projection> inputProjections) {
        Utils.nonNull(expression, "expression data");
        Utils.nonNull(signatures, "signatures");
        Utils.nonNull(precomputed, "precomputed signatures");
        Utils.nonNull(housekeepingGenes, "housekeeping genes");
        Utils.nonNull(inputProjections, "input projections");
        if (expression.kind() != DataKind.EXPRESSION) {
            throw new UserException.BadInput("the input matrix must hold expression values");
        }
        if (expression.numSamples() < 2) {
            throw new UserException.BadInput("at least two samples are required");
        }
        final Set<String> names = new HashSet<>();
        for (final Signature signature : signatures) {
            if (!names.add(signature.getName())) {
                throw new UserException.BadInput(String.format("signature name %s is used more than once", signature.getName()));
            }
        }
        for (final SignatureScore score : precomputed.values()) {
            if (!names.add(score.getName()) || RESERVED_SCORE_NAMES.contains(score.getName())) {
                throw new UserException.BadInput(String.format("precomputed signature name %s clashes with another score", score.getName()));
            }
            if (!score.getSamples().containsAll(expression.samples())) {
                throw new UserException.BadInput(String.format("precomputed signature %s does not cover every sample", score.getName()));
            }
        }
        for (final Projection projection : inputProjections.values()) {
            if (!projection.getSamples().containsAll(expression.samples())) {
                throw new UserException.BadInput(String.format("input projection %s does not cover every sample", projection.getName()));
            }
        }
    }
}
