package org.broadinstitute.fastproject.tools.signatures.io;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.data.DataKind;
import org.broadinstitute.fastproject.tools.signatures.data.ExpressionMatrix;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads genes x samples matrices.
 *
 * <p>
 *     The first line holds a corner cell followed by the sample names; every other line holds a gene name followed
 *     by one value per sample.
 * </p>
 */
public final class ExpressionMatrixReader {
    private static final Logger logger = LogManager.getLogger(ExpressionMatrixReader.class);

    private ExpressionMatrixReader() { }

    /**
     * @throws UserException.MalformedFile on missing or non-numeric values, duplicated labels or non-finite values.
     */
    public static ExpressionMatrix read(final File file) {
        Utils.nonNull(file);
        final TabSeparatedFile table = TabSeparatedFile.read(file);
        if (table.isEmpty()) {
            throw new UserException.MalformedFile(file, "the file has no header line");
        }
        final TabSeparatedFile.Line header = table.getLines().get(0);
        if (header.size() < 2) {
            throw table.formatException(header, "the header must name at least one sample");
        }
        final List<String> samples = new ArrayList<>(header.size() - 1);
        for (int column = 1; column < header.size(); column++) {
            samples.add(header.get(column).trim());
        }
        checkUnique(table, header, samples, "sample");

        final List<TabSeparatedFile.Line> rows = table.getLines().subList(1, table.getLines().size());
        if (rows.isEmpty()) {
            throw new UserException.MalformedFile(file, "the file has no gene lines");
        }
        final List<String> genes = new ArrayList<>(rows.size());
        final double[][] values = new double[rows.size()][samples.size()];
        final Set<String> seenGenes = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            final TabSeparatedFile.Line row = rows.get(i);
            table.checkWidth(row, samples.size() + 1);
            final String gene = row.get(0).trim();
            if (!seenGenes.add(gene)) {
                throw table.formatException(row, String.format("gene %s appears more than once", gene));
            }
            genes.add(gene);
            for (int j = 0; j < samples.size(); j++) {
                values[i][j] = table.parseDouble(row, j + 1);
                if (!Double.isFinite(values[i][j])) {
                    throw table.formatException(row, String.format("value for sample %s is not finite", samples.get(j)));
                }
            }
        }
        logger.info(String.format("Read %d genes and %d samples from %s", genes.size(), samples.size(), file));
        return new ExpressionMatrix(DataKind.EXPRESSION, genes, samples, new Array2DRowRealMatrix(values, false));
    }

    /**
     * Reads weights in [0, 1] with the same layout as an expression matrix.
     * @throws UserException.MalformedFile if a weight lies outside [0, 1].
     */
    public static ExpressionMatrix readWeights(final File file) {
        final ExpressionMatrix weights = read(file);
        final boolean valid = Arrays.stream(weights.values().getData()).flatMapToDouble(Arrays::stream).allMatch(w -> w >= 0 && w <= 1);
        if (!valid) {
            throw new UserException.MalformedFile(file, "weights must lie between 0 and 1");
        }
        return weights;
    }

    private static void checkUnique(final TabSeparatedFile table, final TabSeparatedFile.Line line,
                                    final List<String> labels, final String what) {
        final Set<String> seen = new HashSet<>();
        for (final String label : labels) {
            if (!seen.add(label)) {
                throw table.formatException(line, String.format("%s %s appears more than once", what, label));
            }
        }
    }
}
