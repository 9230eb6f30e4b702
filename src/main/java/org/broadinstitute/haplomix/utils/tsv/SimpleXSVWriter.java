package org.broadinstitute.haplomix.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.haplomix.exceptions.HaplomixException;
import org.broadinstitute.haplomix.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A simple TSV/CSV/XSV writer with a configurable delimiter.
 *
 * First call {@link #setHeaderLine} with the column names, which fixes the number of columns per line. Then call
 * {@link #getNewLineBuilder} for each row, fill in its columns by index or by heading, and call
 * {@link LineBuilder#write()}. A pending line is written out when the next one is requested or on {@link #close()}.
 */
public class SimpleXSVWriter implements Closeable {
    private int expectedNumColumns;
    private Map<String, Integer> headerMap = null;
    private final CSVWriter outputWriter;

    // The current incomplete line in the writer.
    private LineBuilder currentLineBuilder = null;

    /**
     * @param path         the destination path
     * @param separator    separator to use for the XSV file
     * @throws IOException if one was raised when opening the destination file for writing.
     */
    public SimpleXSVWriter(final Path path, final char separator) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8), separator);
    }

    /**
     * @param writer       the destination writer, closed by {@link #close()}
     * @param separator    separator to use for the XSV file
     */
    public SimpleXSVWriter(final Writer writer, final char separator) {
        Utils.nonNull(writer, "The writer cannot be null.");
        Utils.validate(separator != '\n', "Column separator cannot be a newline character");
        outputWriter = new CSVWriter(writer, separator, CSVWriter.NO_QUOTE_CHARACTER, CSVWriter.NO_ESCAPE_CHARACTER, "\n");
    }

    /**
     * Writes the header line. Column names must be unique; this can only be done once.
     */
    public void setHeaderLine(final List<String> columns) {
        Utils.nonNull(columns);
        if (headerMap != null) {
            throw new HaplomixException("Cannot modify header line once set");
        }
        final Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Utils.nonNull(columns.get(i), "Provided header had null column at position: " + i);
            if (index.putIfAbsent(columns.get(i), i) != null) {
                throw new HaplomixException("Column names must be unique, but found a duplicate name: " + columns.get(i));
            }
        }
        outputWriter.writeNext(columns.toArray(new String[0]));
        expectedNumColumns = columns.size();
        headerMap = index;
    }

    /**
     * Builds a new LineBuilder and writes out the previous line if it exists.
     *
     * @return a blank LineBuilder to allow for defining the next line
     */
    public LineBuilder getNewLineBuilder() {
        if (headerMap == null) {
            throw new HaplomixException("Cannot construct line without first setting the header line");
        }
        if (currentLineBuilder != null && !currentLineBuilder.hasBuilt) {
            currentLineBuilder.write();
        }
        currentLineBuilder = new LineBuilder(expectedNumColumns);
        return currentLineBuilder;
    }

    /**
     * @return zero based index of the column with this heading
     */
    public int getIndexForColumn(final String column) {
        Utils.nonNull(headerMap, "Cannot request column index if the header has not been specified");
        final Integer index = headerMap.get(column);
        Utils.nonNull(index, () -> "Requested column " + column + " does not exist in the provided header");
        return index;
    }

    @Override
    public void close() throws IOException {
        if (currentLineBuilder != null && !currentLineBuilder.hasBuilt) {
            currentLineBuilder.write();
        }
        outputWriter.close();
    }

    /**
     * Incremental construction of one body line, by column index or heading.
     * <p>
     * {@link #write()} validates that every column has a value; {@link #fill(String)} provides a default for the
     * columns left undefined.
     */
    public class LineBuilder {
        private final String[] lineToBuild;
        private boolean hasBuilt = false;

        LineBuilder(final int lineLength) {
            lineToBuild = new String[lineLength];
        }

        public LineBuilder setRow(final List<String> row) {
            checkAlterationAfterWrite();
            Utils.validate(row.size() == lineToBuild.length, "Provided line must have the correct number of columns");
            for (int i = 0; i < row.size(); i++) {
                lineToBuild[i] = row.get(i);
            }
            return this;
        }

        public LineBuilder setColumn(final int index, final String value) {
            checkAlterationAfterWrite();
            lineToBuild[index] = value;
            return this;
        }

        public LineBuilder setColumn(final String heading, final String value) {
            return setColumn(getIndexForColumn(heading), value);
        }

        /**
         * Fills in every empty column of the pending line with the provided value
         */
        public LineBuilder fill(final String filling) {
            checkAlterationAfterWrite();
            for (int i = 0; i < lineToBuild.length; i++) {
                if (lineToBuild[i] == null) {
                    lineToBuild[i] = filling;
                }
            }
            return this;
        }

        /**
         * Constructs the line and writes it out to the output
         */
        public void write() {
            checkAlterationAfterWrite();
            Utils.validate(Arrays.stream(lineToBuild).noneMatch(Objects::isNull),
                    () -> "Attempted to construct an incomplete line, make sure all columns are filled: " + Arrays.toString(lineToBuild));
            outputWriter.writeNext(lineToBuild);
            hasBuilt = true;
        }

        private void checkAlterationAfterWrite() {
            Utils.validate(!hasBuilt, "Cannot make alterations to an already written out line");
        }
    }
}
