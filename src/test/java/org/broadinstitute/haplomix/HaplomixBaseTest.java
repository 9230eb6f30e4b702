package org.broadinstitute.haplomix;

import htsjdk.samtools.util.Log;
import org.broadinstitute.haplomix.utils.LoggingUtils;
import org.testng.annotations.BeforeSuite;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we rely on.
 */
public abstract class HaplomixBaseTest {

    private static final String CURRENT_DIRECTORY = System.getProperty("user.dir");
    public static final String haplomixDirectory = System.getProperty("haplomixdir", CURRENT_DIRECTORY) + "/";

    private static final String publicTestDirRelative = "src/test/resources/";
    public static final String publicTestDir = new File(haplomixDirectory, publicTestDirRelative).getAbsolutePath() + "/";

    public static final String packageRootTestDir = publicTestDir + "org/broadinstitute/haplomix/";
    public static final String toolsTestDir = packageRootTestDir + "tools/";

    @BeforeSuite
    public void setTestVerbosity(){
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * Returns the name of the class being tested.
     * The default implementation takes the simple name of the test class and removes the trailing "Test".
     * Override if needed.
     */
    public String getTestedClassName(){
        if (getClass().getSimpleName().contains("IntegrationTest"))
            return getClass().getSimpleName().replaceAll("IntegrationTest$", "");
        else if (getClass().getSimpleName().contains("UnitTest"))
            return getClass().getSimpleName().replaceAll("UnitTest$", "");
        else
            return getClass().getSimpleName().replaceAll("Test$", "");
    }

    /**
     * Creates a temp file that will be deleted on exit after tests are complete.
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = Files.createTempFile(name, extension).toFile();
            file.deleteOnExit();
            return file;
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create temp file: " + name, e);
        }
    }

    /**
     * Writes the lines to a new temp file that will be deleted on exit.
     */
    public static Path writeTempFile(final String name, final String extension, final String... lines) {
        final Path path = createTempFile(name, extension).toPath();
        try {
            Files.write(path, String.join("\n", lines).concat("\n").getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write temp file: " + path, e);
        }
        return path;
    }
}
