package org.broadinstitute.haplomix.exceptions;

/**
 * <p/>
 * Class HaplomixException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class HaplomixException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public HaplomixException( String msg ) {
        super(msg);
    }

    public HaplomixException( String message, Throwable throwable ) {
        super(message, throwable);
    }
}
