package org.broadinstitute.fastproject.tools.signatures.io;

import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads gene lists, one gene per line. Only the first column of each line is used.
 */
public final class GeneListReader {

    private GeneListReader() { }

    public static List<String> read(final File file) {
        Utils.nonNull(file);
        final Set<String> genes = new LinkedHashSet<>();
        for (final TabSeparatedFile.Line line : TabSeparatedFile.read(file).getLines()) {
            genes.add(line.get(0).trim());
        }
        return new ArrayList<>(genes);
    }
}
