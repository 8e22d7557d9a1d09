package org.broadinstitute.signatures.exceptions;

/**
 * <p/>
 * Class SignaturesException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class SignaturesException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public SignaturesException( String msg ) {
        super(msg);
    }

    public SignaturesException( String message, Throwable throwable ) {
        super(message, throwable);
    }
}
