package org.broadinstitute.haplomix.phylotree;

import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link Phylotree} from a comma-separated tree description.
 */
public final class PhylotreeReader {

    private PhylotreeReader() {}

    public static Phylotree read(final Path path) {
        Utils.nonNull(path);
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return Phylotree.fromLines(readLines(reader), path.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Reads a tree from an open reader. The reader is not closed.
     *
     * @param source a name for the input used in error messages
     */
    public static Phylotree read(final Reader reader, final String source) {
        Utils.nonNull(reader);
        try {
            return Phylotree.fromLines(readLines(new BufferedReader(reader)), source);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(source, e.getMessage(), e);
        }
    }

    private static List<String> readLines(final BufferedReader reader) throws IOException {
        final List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }
}
