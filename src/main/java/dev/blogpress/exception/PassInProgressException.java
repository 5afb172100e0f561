package dev.blogpress.exception;

/**
 * A publishing pass was requested while another one is still running.
 */
public class PassInProgressException extends RuntimeException {

    public PassInProgressException() {
        super("A publishing pass is already in progress");
    }
}
