package org.broadinstitute.haplomix.mixture;

import com.opencsv.CSVReader;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.utils.Utils;
import org.broadinstitute.haplomix.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a {@link LogLikelihoodMatrix} from a tab-separated table.
 *
 * <p>The header is {@code READ WEIGHT <haplogroup>...}; each following row holds a read name, its non-negative weight
 * and one natural-log likelihood per haplogroup ({@code -Infinity} is allowed). Lines starting with
 * {@value TableUtils#COMMENT_PREFIX} and blank lines are skipped.</p>
 */
public final class LogLikelihoodMatrixReader {

    public static final String READ_COLUMN = "READ";
    public static final String WEIGHT_COLUMN = "WEIGHT";

    private final String source;
    private final LineNumberReader reader;

    private LogLikelihoodMatrixReader(final String source, final Reader reader) {
        this.source = source;
        this.reader = reader instanceof LineNumberReader ? (LineNumberReader) reader : new LineNumberReader(reader);
    }

    public static LogLikelihoodMatrix read(final Path path) {
        Utils.nonNull(path);
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new LogLikelihoodMatrixReader(path.toString(), reader).readMatrix();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Reads a matrix from an open reader. The reader is not closed.
     *
     * @param source a name for the input used in error messages
     */
    public static LogLikelihoodMatrix read(final Reader reader, final String source) {
        Utils.nonNull(reader);
        try {
            return new LogLikelihoodMatrixReader(source, reader).readMatrix();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(source, e.getMessage(), e);
        }
    }

    private LogLikelihoodMatrix readMatrix() throws IOException {
        final CSVReader csvReader = new CSVReader(reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);

        final String[] header = nextDataLine(csvReader);
        if (header == null) {
            throw formatException("premature end of table: header line not found");
        }
        if (header.length < 3 || !READ_COLUMN.equals(header[0]) || !WEIGHT_COLUMN.equals(header[1])) {
            throw formatException(String.format("header must start with %s and %s followed by at least one haplogroup but was %s",
                    READ_COLUMN, WEIGHT_COLUMN, Arrays.toString(header)));
        }
        final List<String> haplogroups = Arrays.asList(header).subList(2, header.length);
        final Set<String> seen = new HashSet<>();
        for (final String haplogroup : haplogroups) {
            if (haplogroup.isEmpty() || !seen.add(haplogroup)) {
                throw formatException("haplogroup names in the header must be non-empty and unique: '" + haplogroup + "'");
            }
            if (READ_COLUMN.equals(haplogroup) || WEIGHT_COLUMN.equals(haplogroup)) {
                throw formatException(String.format("%s and %s are reserved column names and cannot name a haplogroup",
                        READ_COLUMN, WEIGHT_COLUMN));
            }
        }

        final List<String> readNames = new ArrayList<>();
        final List<Double> weights = new ArrayList<>();
        final List<double[]> rows = new ArrayList<>();
        String[] line;
        while ((line = nextDataLine(csvReader)) != null) {
            if (line.length != header.length) {
                throw formatException(String.format("expected %d columns but found %d", header.length, line.length));
            }
            final double weight = parseDouble(line[1], WEIGHT_COLUMN);
            if (!(weight >= 0.0) || Double.isInfinite(weight)) {
                throw formatException("weights must be finite and non-negative but found " + line[1]);
            }
            final double[] values = new double[haplogroups.size()];
            for (int g = 0; g < values.length; g++) {
                values[g] = parseDouble(line[g + 2], haplogroups.get(g));
                if (Double.isNaN(values[g]) || values[g] == Double.POSITIVE_INFINITY) {
                    throw formatException("log likelihoods cannot be NaN or positive infinity but found " + line[g + 2]);
                }
            }
            readNames.add(line[0]);
            weights.add(weight);
            rows.add(values);
        }
        if (rows.isEmpty()) {
            throw formatException("the table has no reads");
        }
        return new LogLikelihoodMatrix(readNames, haplogroups,
                weights.stream().mapToDouble(Double::doubleValue).toArray(), rows.toArray(new double[0][]));
    }

    private String[] nextDataLine(final CSVReader csvReader) throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            final boolean blank = line.length == 1 && line[0].trim().isEmpty();
            if (!blank && !line[0].startsWith(TableUtils.COMMENT_PREFIX)) {
                return line;
            }
        }
        return null;
    }

    private double parseDouble(final String value, final String column) {
        try {
            return Double.parseDouble(value.trim());
        } catch (final NumberFormatException e) {
            throw formatException(String.format("column %s has a non-numeric value '%s'", column, value));
        }
    }

    private UserException.BadInput formatException(final String message) {
        return new UserException.BadInput(String.format("format error in '%s' at line %d: %s", source, reader.getLineNumber(), message));
    }
}
