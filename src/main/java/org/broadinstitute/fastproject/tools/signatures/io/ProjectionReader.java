package org.broadinstitute.fastproject.tools.signatures.io;

import org.apache.commons.io.FilenameUtils;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.projection.Projection;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads externally computed two-dimensional projections.
 *
 * <p>
 *     The first line is a header with three columns; every other line holds a sample name and its x and y
 *     coordinates. The projection is named after the file, without its extension.
 * </p>
 */
public final class ProjectionReader {

    private ProjectionReader() { }

    public static Projection read(final File file) {
        Utils.nonNull(file);
        final TabSeparatedFile table = TabSeparatedFile.read(file);
        if (table.getLines().size() < 2) {
            throw new UserException.MalformedFile(file, "expected a header line and at least one sample line");
        }
        table.checkWidth(table.getLines().get(0), 3);
        final List<TabSeparatedFile.Line> rows = table.getLines().subList(1, table.getLines().size());
        final List<String> samples = new ArrayList<>(rows.size());
        final double[][] coordinates = new double[rows.size()][2];
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            final TabSeparatedFile.Line row = rows.get(i);
            table.checkWidth(row, 3);
            final String sample = row.get(0).trim();
            if (!seen.add(sample)) {
                throw table.formatException(row, String.format("sample %s appears more than once", sample));
            }
            samples.add(sample);
            coordinates[i][0] = table.parseDouble(row, 1);
            coordinates[i][1] = table.parseDouble(row, 2);
        }
        return Projection.of(FilenameUtils.getBaseName(file.getName()), samples, coordinates);
    }
}
