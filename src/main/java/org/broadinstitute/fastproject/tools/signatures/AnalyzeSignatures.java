package org.broadinstitute.fastproject.tools.signatures;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.fastproject.cmdline.CommandLineProgram;
import org.broadinstitute.fastproject.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.fastproject.cmdline.programgroups.SignatureAnalysisProgramGroup;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.tools.signatures.io.ExpressionMatrixReader;
import org.broadinstitute.fastproject.tools.signatures.io.GeneListReader;
import org.broadinstitute.fastproject.tools.signatures.io.PrecomputedSignatureReader;
import org.broadinstitute.fastproject.tools.signatures.io.ProjectionReader;
import org.broadinstitute.fastproject.tools.signatures.io.SignatureReader;
import org.broadinstitute.fastproject.tools.signatures.pipeline.AnalysisResult;
import org.broadinstitute.fastproject.tools.signatures.pipeline.FastProjectPipeline;
import org.broadinstitute.fastproject.tools.signatures.pipeline.Model;
import org.broadinstitute.fastproject.tools.signatures.pipeline.ProjectionData;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores gene signatures on an expression matrix, projects the samples into two dimensions with several methods
 * and gene filters, and reports which signatures vary consistently across each projection.
 *
 * <h3>Inputs</h3>
 * <ul>
 *     <li>Tab-separated expression matrix, genes x samples</li>
 *     <li>One or more signature files, in GMT format or as signed name/sign/gene lines</li>
 *     <li>Optionally: precomputed signature scores, housekeeping genes, entry weights and input projections</li>
 * </ul>
 *
 * <h3>Example</h3>
 * <pre>
 * fastproject AnalyzeSignatures \
 *   -I expression.tsv \
 *   -S signatures.gmt \
 *   -H housekeeping.txt \
 *   --random-seed 1
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Scores gene signatures and evaluates their consistency over two-dimensional projections of the samples",
        oneLineSummary = "Scores gene signatures against projections of expression data",
        programGroup = SignatureAnalysisProgramGroup.class
)
public final class AnalyzeSignatures extends CommandLineProgram {

    @Argument(
            doc = "Expression matrix, genes x samples.",
            fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME
    )
    protected File inputFile;

    @Argument(
            doc = "Signature files; files ending in .gmt are read as unsigned gene sets.",
            fullName = StandardArgumentDefinitions.SIGNATURES_LONG_NAME,
            shortName = StandardArgumentDefinitions.SIGNATURES_SHORT_NAME,
            optional = true
    )
    protected List<File> signatureFiles = new ArrayList<>();

    @Argument(
            doc = "Precomputed signature scores, samples x signatures.",
            fullName = StandardArgumentDefinitions.PRECOMPUTED_SIGNATURES_LONG_NAME,
            shortName = StandardArgumentDefinitions.PRECOMPUTED_SIGNATURES_SHORT_NAME,
            optional = true
    )
    protected File precomputedFile;

    @Argument(
            doc = "Housekeeping genes used to estimate false-negative rates, one per line. " +
                    "When fewer than 10 are present in the data all genes are used.",
            fullName = StandardArgumentDefinitions.HOUSEKEEPING_GENES_LONG_NAME,
            shortName = StandardArgumentDefinitions.HOUSEKEEPING_GENES_SHORT_NAME,
            optional = true
    )
    protected File housekeepingFile;

    @Argument(
            doc = "Weights for each entry of the expression matrix, in its layout; replaces the computed weights.",
            fullName = StandardArgumentDefinitions.INPUT_WEIGHTS_LONG_NAME,
            optional = true
    )
    protected File inputWeightsFile;

    @Argument(
            doc = "Externally computed projection with a header line and sample, x, y lines; named after the file.",
            fullName = StandardArgumentDefinitions.INPUT_PROJECTION_LONG_NAME,
            optional = true
    )
    protected List<File> inputProjectionFiles = new ArrayList<>();

    @ArgumentCollection
    protected SignatureAnalysisArgumentCollection analysisArguments = new SignatureAnalysisArgumentCollection();

    @Override
    protected String[] customCommandLineValidation() {
        if (signatureFiles.isEmpty() && precomputedFile == null) {
            return new String[]{"at least one signature file or a precomputed signature file is required"};
        }
        return null;
    }

    @Override
    protected void onStartup() {
        analysisArguments.validate();
    }

    @Override
    protected Object doWork() {
        final ExpressionMatrix expression = ExpressionMatrixReader.read(inputFile);
        final List<Signature> signatures = SignatureReader.readAll(signatureFiles);
        final Map<String, SignatureScore> precomputed = precomputedFile == null
                ? Collections.emptyMap() : PrecomputedSignatureReader.read(precomputedFile);
        final List<String> housekeepingGenes = housekeepingFile == null
                ? Collections.emptyList() : GeneListReader.read(housekeepingFile);
        final ExpressionMatrix inputWeights = inputWeightsFile == null ? null : ExpressionMatrixReader.readWeights(inputWeightsFile);
        final Map<String, Projection> inputProjections = new LinkedHashMap<>();
        for (final File file : inputProjectionFiles) {
            final Projection projection = ProjectionReader.read(file);
            if (inputProjections.put(projection.getName(), projection) != null) {
                throw new UserException.BadInput(String.format("more than one input projection is named %s", projection.getName()));
            }
        }

        final AnalysisResult result = FastProjectPipeline.fromArguments(analysisArguments)
                .run(expression, signatures, precomputed, housekeepingGenes, inputProjections, inputWeights);
        logSummary(result);
        return result;
    }

    private void logSummary(final AnalysisResult result) {
        for (final Model model : result.getModels().values()) {
            logger.info(String.format("Model %s: %d signatures retained", model.getName(), model.getSignatureScores().size()));
            for (final ProjectionData pd : model.getProjectionData()) {
                final Map<String, Double> minimumLogP = pd.minimumLogPValues();
                final long significant = minimumLogP.values().stream().filter(p -> p <= Math.log10(0.05)).count();
                logger.info(String.format("  %s: %d genes, %d projections, %d of %d signatures with p <= 0.05",
                        pd.describe(), pd.getGenes().size(), pd.getProjections().size(), significant, minimumLogP.size()));
            }
        }
    }
}
