package org.broadinstitute.fastproject.tools.signatures.io;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.broadinstitute.fastproject.exceptions.UserException;
import org.broadinstitute.fastproject.utils.Utils;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lines of a tab-separated text file, split into values.
 *
 * <p>
 *     Lines starting with {@value #COMMENT_PREFIX} and blank lines are skipped. Values are not quoted.
 * </p>
 */
public final class TabSeparatedFile {

    public static final String COMMENT_PREFIX = "#";
    public static final char COLUMN_SEPARATOR = '\t';

    private final File file;
    private final List<Line> lines;

    private TabSeparatedFile(final File file, final List<Line> lines) {
        this.file = file;
        this.lines = lines;
    }

    /**
     * One non-comment line with its 1-based number in the file.
     */
    public static final class Line {
        private final int number;
        private final String[] values;

        Line(final int number, final String[] values) {
            this.number = number;
            this.values = values;
        }

        public int getNumber() {
            return number;
        }

        public int size() {
            return values.length;
        }

        public String get(final int column) {
            return values[column];
        }
    }

    /**
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     */
    public static TabSeparatedFile read(final File file) {
        Utils.nonNull(file);
        try (final Reader reader = new FileReader(file, StandardCharsets.UTF_8)) {
            return read(file, reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    /**
     * Reads from {@code reader}; {@code file} only names the source in error messages.
     */
    static TabSeparatedFile read(final File file, final Reader reader) throws IOException {
        final LineNumberReader lineNumberReader = new LineNumberReader(reader);
        final CSVParser parser = new CSVParserBuilder()
                .withSeparator(COLUMN_SEPARATOR)
                .withIgnoreQuotations(true)
                .build();
        final List<Line> result = new ArrayList<>();
        try (final CSVReader csvReader = new CSVReaderBuilder(lineNumberReader).withCSVParser(parser).build()) {
            String[] values;
            while ((values = csvReader.readNext()) != null) {
                if (isBlank(values) || values[0].startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                result.add(new Line(lineNumberReader.getLineNumber(), values));
            }
        } catch (final CsvValidationException e) {
            throw new UserException.MalformedFile(file, "could not split a line into values", e);
        }
        return new TabSeparatedFile(file, Collections.unmodifiableList(result));
    }

    public File getFile() {
        return file;
    }

    public List<Line> getLines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Parses a numeric value.
     * @throws UserException.MalformedFile if the value is not a number.
     */
    public double parseDouble(final Line line, final int column) {
        final String value = line.get(column).trim();
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw formatException(line, String.format("'%s' in column %d is not a number", value, column + 1));
        }
    }

    /**
     * @throws UserException.MalformedFile if the line does not have exactly {@code expected} values.
     */
    public void checkWidth(final Line line, final int expected) {
        if (line.size() != expected) {
            throw formatException(line, String.format("expected %d values but found %d", expected, line.size()));
        }
    }

    public UserException.MalformedFile formatException(final Line line, final String message) {
        return new UserException.MalformedFile(file, String.format("line %d: %s", line.getNumber(), message));
    }

    private static boolean isBlank(final String[] values) {
        for (final String value : values) {
            if (!value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
