package dev.blogpress.exception;

/**
 * The content store could not answer the due-article query. Aborts the current pass only.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
