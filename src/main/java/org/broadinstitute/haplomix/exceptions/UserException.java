package org.broadinstitute.haplomix.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }

        public CouldNotReadInputFile(final String source, final String message, final Throwable cause) {
            super(String.format("Couldn't read %s. Error was: %s", source, message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final String source, final String message) {
            super(String.format("%s is malformed: %s", source, message));
        }

        public MalformedFile(final String source, final int lineNumber, final String message) {
            super(String.format("%s is malformed at line %d: %s", source, lineNumber, message));
        }
    }
}
