package com.enterprise.sheetrecovery.core;

/**
 * The structured decoder rejected the input or returned no sheets.
 */
public class DecodeFailureException extends RecoveryException {

    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
