package app.listify.assets.error;

/**
 * Wraps a checked failure from a remote call once all retry attempts are spent.
 */
public class TransientServiceException extends RuntimeException {

    public TransientServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
