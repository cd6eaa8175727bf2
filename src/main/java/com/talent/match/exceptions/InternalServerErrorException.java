package com.talent.match.exceptions;

/**
 * Exception thrown when an internal server error occurs.
 * <p>
 * Wraps storage or infrastructure failures that the caller can do nothing about.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
