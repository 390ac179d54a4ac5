package org.broadinstitute.fastproject.tools.signatures.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.scoring.SignatureScore;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads precomputed signature scores.
 *
 * <p>
 *     The first line holds a corner cell followed by the signature names; every other line holds a sample name
 *     followed by one value per signature. A column whose values are all numbers is read as a continuous score,
 *     any other column as a factor.
 * </p>
 */
public final class PrecomputedSignatureReader {
    private static final Logger logger = LogManager.getLogger(PrecomputedSignatureReader.class);

    private PrecomputedSignatureReader() { }

    /**
     * @return scores by name, in column order.
     */
    public static Map<String, SignatureScore> read(final File file) {
        Utils.nonNull(file);
        final TabSeparatedFile table = TabSeparatedFile.read(file);
        if (table.getLines().size() < 2) {
            throw new UserException.MalformedFile(file, "expected a header line and at least one sample line");
        }
        final TabSeparatedFile.Line header = table.getLines().get(0);
        final int numSignatures = header.size() - 1;
        if (numSignatures < 1) {
            throw table.formatException(header, "the header must name at least one signature");
        }
        final List<TabSeparatedFile.Line> rows = table.getLines().subList(1, table.getLines().size());
        final List<String> samples = new ArrayList<>(rows.size());
        final Set<String> seenSamples = new HashSet<>();
        for (final TabSeparatedFile.Line row : rows) {
            table.checkWidth(row, header.size());
            final String sample = row.get(0).trim();
            if (!seenSamples.add(sample)) {
                throw table.formatException(row, String.format("sample %s appears more than once", sample));
            }
            samples.add(sample);
        }

        final Map<String, SignatureScore> result = new LinkedHashMap<>();
        for (int column = 1; column <= numSignatures; column++) {
            final String name = header.get(column).trim();
            if (result.containsKey(name)) {
                throw table.formatException(header, String.format("signature %s appears more than once", name));
            }
            final List<String> labels = new ArrayList<>(rows.size());
            boolean numeric = true;
            for (final TabSeparatedFile.Line row : rows) {
                final String value = row.get(column).trim();
                labels.add(value);
                numeric &= isNumber(value);
            }
            if (numeric) {
                final double[] values = labels.stream().mapToDouble(Double::parseDouble).toArray();
                result.put(name, SignatureScore.continuous(name, samples, values, true, 0));
            } else {
                result.put(name, SignatureScore.factor(name, samples, labels));
            }
        }
        logger.info(String.format("Read %d precomputed signatures over %d samples from %s", result.size(), samples.size(), file));
        return result;
    }

    private static boolean isNumber(final String value) {
        try {
            return Double.isFinite(Double.parseDouble(value));
        } catch (final NumberFormatException e) {
            return false;
        }
    }
}
