package org.broadinstitute.fastproject.tools.signatures.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.tools.signatures.scoring.Signature;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads signature definitions.
 *
 * <ul>
 *     <li>Files ending in {@value #GMT_EXTENSION}: one signature per line, name, description and genes. Every gene
 *     gets a positive sign and the signature is unsigned.</li>
 *     <li>Any other file: one gene per line as name, sign and gene, where the sign is one of
 *     {@code plus, minus, +, -, 1, -1}. The lines of a signature need not be adjacent.</li>
 * </ul>
 */
public final class SignatureReader {
    private static final Logger logger = LogManager.getLogger(SignatureReader.class);

    public static final String GMT_EXTENSION = ".gmt";

    private SignatureReader() { }

    /**
     * Reads several files.
     * @throws UserException.BadInput if a signature name appears in more than one file.
     */
    public static List<Signature> readAll(final List<File> files) {
        Utils.nonNull(files);
        final List<Signature> result = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        for (final File file : files) {
            for (final Signature signature : read(file)) {
                if (!names.add(signature.getName())) {
                    throw new UserException.BadInput(String.format("signature %s is defined more than once (again in %s)",
                            signature.getName(), file));
                }
                result.add(signature);
            }
        }
        return result;
    }

    public static List<Signature> read(final File file) {
        Utils.nonNull(file);
        final TabSeparatedFile table = TabSeparatedFile.read(file);
        final List<Signature> result = file.getName().toLowerCase().endsWith(GMT_EXTENSION)
                ? readGmt(table) : readSigned(table);
        logger.info(String.format("Read %d signatures from %s", result.size(), file));
        return result;
    }

    private static List<Signature> readGmt(final TabSeparatedFile table) {
        final List<Signature> result = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        for (final TabSeparatedFile.Line line : table.getLines()) {
            if (line.size() < 3) {
                throw table.formatException(line, "expected a name, a description and at least one gene");
            }
            final String name = line.get(0).trim();
            if (!names.add(name)) {
                throw table.formatException(line, String.format("signature %s is defined more than once", name));
            }
            final Map<String, Integer> signs = new LinkedHashMap<>();
            for (int column = 2; column < line.size(); column++) {
                final String gene = line.get(column).trim();
                if (!gene.isEmpty()) {
                    signs.put(gene, 1);
                }
            }
            if (signs.isEmpty()) {
                throw table.formatException(line, String.format("signature %s has no genes", name));
            }
            result.add(new Signature(name, signs, false, table.getFile().getName()));
        }
        return result;
    }

    private static List<Signature> readSigned(final TabSeparatedFile table) {
        final Map<String, Map<String, Integer>> signsByName = new LinkedHashMap<>();
        for (final TabSeparatedFile.Line line : table.getLines()) {
            table.checkWidth(line, 3);
            final String name = line.get(0).trim();
            final int sign = parseSign(table, line, line.get(1).trim());
            final String gene = line.get(2).trim();
            final Integer previous = signsByName.computeIfAbsent(name, n -> new LinkedHashMap<>()).put(gene, sign);
            if (previous != null && previous != sign) {
                throw table.formatException(line, String.format("gene %s has both signs in signature %s", gene, name));
            }
        }
        final List<Signature> result = new ArrayList<>(signsByName.size());
        signsByName.forEach((name, signs) -> result.add(new Signature(name, signs, true, table.getFile().getName())));
        return result;
    }

    static int parseSign(final TabSeparatedFile table, final TabSeparatedFile.Line line, final String value) {
        switch (value.toLowerCase()) {
            case "plus":
            case "+":
            case "1":
                return 1;
            case "minus":
            case "-":
            case "-1":
                return -1;
            default:
                throw table.formatException(line, String.format("'%s' is not a sign", value));
        }
    }
}
