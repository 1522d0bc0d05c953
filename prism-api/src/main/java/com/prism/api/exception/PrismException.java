package com.prism.api.exception;

/**
 * Prism 基础异常
 *
 * @author Prism
 */
public class PrismException extends RuntimeException {

    public PrismException(String message) {
        super(message);
    }

    public PrismException(String message, Throwable cause) {
        super(message, cause);
    }
}
