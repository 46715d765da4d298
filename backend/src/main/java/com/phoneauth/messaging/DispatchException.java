package com.phoneauth.messaging;

/**
 * Exception thrown when a one-time code cannot be handed to the delivery transport.
 *
 * OTPService catches it and reports the issuance as undelivered; the stored
 * code is not rolled back.
 */
public class DispatchException extends RuntimeException {

    /**
     * Constructs a new DispatchException with the specified detail message.
     *
     * @param message the detail message
     */
    public DispatchException(String message) {
        super(message);
    }

    /**
     * Constructs a new DispatchException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
